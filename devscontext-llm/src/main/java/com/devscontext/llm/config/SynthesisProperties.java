package com.devscontext.llm.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Synthesis settings, bound from {@code devscontext.synthesis.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "devscontext.synthesis")
public class SynthesisProperties {

    /** "llm" or "passthrough". */
    @NotBlank
    @Pattern(regexp = "(?i)llm|passthrough", message = "must be llm or passthrough")
    private String plugin = "llm";

    @NotBlank
    @Pattern(regexp = "(?i)anthropic|openai|ollama", message = "must be anthropic, openai or ollama")
    private String provider = "anthropic";

    /** Empty means the provider's default model. */
    private String model = "claude-haiku-4-5";

    private String apiKey;

    /** Overrides the provider endpoint, e.g. a remote Ollama host. */
    private String baseUrl;

    @Min(256)
    private int maxOutputTokens = 3000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double temperature = 0.0;

    @NotNull
    private Duration timeout = Duration.ofSeconds(60);

    /** Optional path to a custom synthesis prompt template. */
    private String promptTemplate;

    public boolean isPassthrough() {
        return "passthrough".equalsIgnoreCase(plugin);
    }
}
