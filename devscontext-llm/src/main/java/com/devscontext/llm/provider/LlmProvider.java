package com.devscontext.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * LLM providers usable for synthesis.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {

    ANTHROPIC(
        "Anthropic",
        "https://api.anthropic.com",
        "/v1/messages",
        "claude-haiku-4-5",
        true
    ),

    OPENAI(
        "OpenAI",
        "https://api.openai.com",
        "/v1/chat/completions",
        "gpt-4o-mini",
        true
    ),

    // Local server, no key
    OLLAMA(
        "Ollama",
        "http://localhost:11434",
        "/api/generate",
        "llama3.2",
        false
    );

    private final String displayName;
    private final String baseUrl;
    private final String path;
    private final String defaultModel;
    private final boolean apiKeyRequired;

    public static LlmProvider fromString(String name) {
        for (LlmProvider provider : values()) {
            if (provider.name().equalsIgnoreCase(name) ||
                provider.getDisplayName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + name);
    }
}
