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
public class AnthropicProviderClient extends AbstractHttpProviderClient {

    private static final String API_VERSION = "2023-06-01";

    public AnthropicProviderClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                   SynthesisProperties properties) {
        super(webClientBuilder, objectMapper, properties);
    }

    @Override
    protected Map<String, Object> buildRequest(String prompt, String model, int maxTokens, double temperature) {
        return Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "temperature", temperature,
            "messages", List.of(
                Map.of("role", "user", "content", prompt)
            )
        );
    }

    @Override
    protected void applyAuth(HttpHeaders headers, String apiKey) {
        headers.set("x-api-key", apiKey);
        headers.set("anthropic-version", API_VERSION);
    }

    @Override
    protected String extractContent(JsonNode root) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.toString();
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.ANTHROPIC;
    }
}
