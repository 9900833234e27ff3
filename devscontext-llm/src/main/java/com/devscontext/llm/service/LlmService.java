package com.devscontext.llm.service;

import com.devscontext.common.exception.SynthesisException;
import com.devscontext.llm.config.SynthesisProperties;
import com.devscontext.llm.provider.LlmProvider;
import com.devscontext.llm.provider.ProviderClient;
import com.devscontext.llm.provider.ProviderClient.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for LLM calls. Routes to the client of the configured
 * provider and turns provider failures into {@link SynthesisException}.
 */
@Service
@Slf4j
public class LlmService {

    private final Map<LlmProvider, ProviderClient> clients = new EnumMap<>(LlmProvider.class);
    private final SynthesisProperties properties;
    private final LlmProvider provider;

    public LlmService(List<ProviderClient> providerClients, SynthesisProperties properties) {
        this.properties = properties;
        this.provider = LlmProvider.fromString(properties.getProvider());
        for (ProviderClient client : providerClients) {
            clients.put(client.getProvider(), client);
        }
        log.info("[LLM] Initialized | provider={} | model={} | configured={}",
            provider, effectiveModel(), isConfigured());
    }

    /**
     * True when the configured provider can be called: a client exists and,
     * for hosted providers, an API key is set.
     */
    public boolean isConfigured() {
        if (!clients.containsKey(provider)) {
            return false;
        }
        return !provider.isApiKeyRequired()
            || (properties.getApiKey() != null && !properties.getApiKey().isBlank());
    }

    public String generateContent(String prompt) {
        return generateContent(prompt, properties.getMaxOutputTokens());
    }

    public String generateContent(String prompt, int maxTokens) {
        ProviderClient client = clients.get(provider);
        if (client == null) {
            throw new SynthesisException("No client registered for provider " + provider);
        }
        try {
            return client.generateContent(prompt, properties.getApiKey(), effectiveModel(),
                maxTokens, properties.getTemperature());
        } catch (ProviderException e) {
            if (e.isAuthError()) {
                log.error("[LLM] Provider rejected credentials, check devscontext.synthesis.api-key | provider={}", provider);
            } else if (e.isRateLimited()) {
                log.warn("[LLM] Provider rate limit hit | provider={}", provider);
            }
            log.warn("[LLM] Generation failed | provider={} | statusCode={} | retryable={} | error={}",
                provider, e.getStatusCode(), e.isRetryable(), e.getMessage());
            throw new SynthesisException("Failed to generate content: " + e.getMessage(),
                Map.of("provider", provider.name(), "statusCode", e.getStatusCode(), "retryable", e.isRetryable()), e);
        }
    }

    public String generateJsonContent(String prompt, int maxTokens) {
        String jsonPrompt = prompt + "\n\nRespond with valid JSON only. No markdown, no code blocks.";
        return generateContent(jsonPrompt, maxTokens);
    }

    public LlmProvider getProvider() {
        return provider;
    }

    public String effectiveModel() {
        String model = properties.getModel();
        return model != null && !model.isBlank() ? model : provider.getDefaultModel();
    }
}
