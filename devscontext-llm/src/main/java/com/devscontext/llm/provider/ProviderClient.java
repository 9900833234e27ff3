package com.devscontext.llm.provider;

import lombok.Getter;

/**
 * One hosted or local LLM backend. Implementations are stateless and share the
 * application's {@code WebClient.Builder}.
 */
public interface ProviderClient {

    /**
     * Runs a single-turn completion and returns the generated text.
     *
     * @throws ProviderException on transport errors, non-2xx responses or empty output
     */
    String generateContent(String prompt, String apiKey, String model, int maxTokens, double temperature);

    LlmProvider getProvider();

    /**
     * Failure reported by a provider. Transport and parse failures use status 500.
     */
    @Getter
    class ProviderException extends RuntimeException {

        private final LlmProvider provider;
        private final int statusCode;
        private final boolean retryable;

        public ProviderException(String message, LlmProvider provider, int statusCode, boolean retryable) {
            this(message, provider, statusCode, retryable, null);
        }

        public ProviderException(String message, LlmProvider provider, int statusCode, boolean retryable, Throwable cause) {
            super(message, cause);
            this.provider = provider;
            this.statusCode = statusCode;
            this.retryable = retryable;
        }

        public boolean isRateLimited() {
            return statusCode == 429;
        }

        public boolean isAuthError() {
            return statusCode == 401 || statusCode == 403;
        }
    }
}
