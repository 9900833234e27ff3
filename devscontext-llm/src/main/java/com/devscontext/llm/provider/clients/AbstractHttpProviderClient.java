package com.devscontext.llm.provider.clients;

import com.devscontext.llm.config.SynthesisProperties;
import com.devscontext.llm.provider.LlmProvider;
import com.devscontext.llm.provider.ProviderClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * Request/response plumbing shared by the HTTP provider clients. Subclasses
 * supply the request body, the auth headers and the response extraction.
 */
@Slf4j
public abstract class AbstractHttpProviderClient implements ProviderClient {

    protected final ObjectMapper objectMapper;
    private final WebClient webClient;
    private final Duration timeout;
    private final String tag;

    protected AbstractHttpProviderClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                         SynthesisProperties properties) {
        this.objectMapper = objectMapper;
        this.timeout = properties.getTimeout();
        this.tag = "[" + getProvider().name() + "]";
        String baseUrl = properties.getBaseUrl() != null && !properties.getBaseUrl().isBlank()
            && LlmProvider.fromString(properties.getProvider()) == getProvider()
            ? properties.getBaseUrl()
            : getProvider().getBaseUrl();
        this.webClient = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    protected abstract Map<String, Object> buildRequest(String prompt, String model, int maxTokens, double temperature);

    protected abstract void applyAuth(HttpHeaders headers, String apiKey);

    protected abstract String extractContent(JsonNode root);

    @Override
    public String generateContent(String prompt, String apiKey, String model, int maxTokens, double temperature)
            throws ProviderException {
        long startTime = System.currentTimeMillis();
        String effectiveModel = model != null && !model.isBlank() ? model : getProvider().getDefaultModel();

        if (getProvider().isApiKeyRequired() && (apiKey == null || apiKey.isBlank())) {
            throw new ProviderException(getProvider().getDisplayName() + " API key is not configured",
                getProvider(), 401, false);
        }

        log.info("{} Starting content generation | model={} | promptLength={} | maxTokens={}",
            tag, effectiveModel, prompt.length(), maxTokens);

        try {
            String response = webClient.post()
                .uri(getProvider().getPath())
                .headers(headers -> applyAuth(headers, apiKey))
                .bodyValue(buildRequest(prompt, effectiveModel, maxTokens, temperature))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();

            String content = parse(response);
            long duration = System.currentTimeMillis() - startTime;
            log.info("{} Content generated successfully | model={} | durationMs={} | responseLength={}",
                tag, effectiveModel, duration, content.length());
            return content;

        } catch (WebClientResponseException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("{} HTTP error | model={} | statusCode={} | statusText={} | durationMs={}",
                tag, effectiveModel, e.getStatusCode().value(), e.getStatusText(), duration);
            throw mapException(e);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("{} Request failed | model={} | durationMs={} | error={}",
                tag, effectiveModel, duration, e.getMessage(), e);
            throw new ProviderException(
                getProvider().getDisplayName() + " request failed: " + e.getMessage(),
                getProvider(), 500, true, e
            );
        }
    }

    private String parse(String response) throws ProviderException {
        String content;
        try {
            content = extractContent(objectMapper.readTree(response));
        } catch (Exception e) {
            throw new ProviderException(
                "Failed to parse " + getProvider().getDisplayName() + " response",
                getProvider(), 500, false, e
            );
        }
        if (content == null || content.isBlank()) {
            throw new ProviderException(
                getProvider().getDisplayName() + " returned an empty response",
                getProvider(), 500, false
            );
        }
        return content;
    }

    private ProviderException mapException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        // 429 and 5xx are worth another attempt on the next cycle
        boolean retryable = status == 429 || status >= 500;
        String message = String.format("%s API error: %d %s", getProvider().getDisplayName(), status, e.getStatusText());

        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            JsonNode errorMessage = error.path("error").path("message");
            if (errorMessage.isTextual()) {
                message = errorMessage.asText();
            } else if (error.path("error").isTextual()) {
                message = error.path("error").asText();
            }
        } catch (Exception parseFailure) {
            log.debug("{} Error body is not JSON | statusCode={}", tag, status);
        }

        return new ProviderException(message, getProvider(), status, retryable, e);
    }
}
