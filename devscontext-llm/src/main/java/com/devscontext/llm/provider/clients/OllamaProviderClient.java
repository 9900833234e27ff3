package com.devscontext.llm.provider.clients;

import com.devscontext.llm.config.SynthesisProperties;
import com.devscontext.llm.provider.LlmProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

@Component
public class OllamaProviderClient extends AbstractHttpProviderClient {

    public OllamaProviderClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                SynthesisProperties properties) {
        super(webClientBuilder, objectMapper, properties);
    }

    @Override
    protected Map<String, Object> buildRequest(String prompt, String model, int maxTokens, double temperature) {
        return Map.of(
            "model", model,
            "prompt", prompt,
            "stream", false,
            "options", Map.of(
                "num_predict", maxTokens,
                "temperature", temperature
            )
        );
    }

    @Override
    protected void applyAuth(HttpHeaders headers, String apiKey) {
        // local server
    }

    @Override
    protected String extractContent(JsonNode root) {
        return root.path("response").asText("");
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.OLLAMA;
    }
}
