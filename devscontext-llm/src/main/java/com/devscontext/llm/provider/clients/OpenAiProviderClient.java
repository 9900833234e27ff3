package com.devscontext.llm.provider.clients;

import com.devscontext.llm.config.SynthesisProperties;
import com.devscontext.llm.provider.LlmProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

@Component
public class OpenAiProviderClient extends AbstractHttpProviderClient {

    public OpenAiProviderClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                SynthesisProperties properties) {
        super(webClientBuilder, objectMapper, properties);
    }

    @Override
    protected Map<String, Object> buildRequest(String prompt, String model, int maxTokens, double temperature) {
        return Map.of(
            "model", model,
            "messages", List.of(
                Map.of("role", "user", "content", prompt)
            ),
            "max_tokens", maxTokens,
            "temperature", temperature
        );
    }

    @Override
    protected void applyAuth(HttpHeaders headers, String apiKey) {
        headers.setBearerAuth(apiKey);
    }

    @Override
    protected String extractContent(JsonNode root) {
        return root.path("choices").path(0).path("message").path("content").asText("");
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.OPENAI;
    }
}
