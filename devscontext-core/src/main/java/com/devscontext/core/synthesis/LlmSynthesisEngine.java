package com.devscontext.core.synthesis;

import com.devscontext.common.exception.ConfigurationException;
import com.devscontext.common.exception.SynthesisException;
import com.devscontext.common.util.TextUtils;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.jira.JiraContext;
import com.devscontext.core.model.jira.JiraTicket;
import com.devscontext.llm.config.SynthesisProperties;
import com.devscontext.llm.prompt.SynthesisPrompts;
import com.devscontext.llm.service.LlmService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Synthesizes context with the configured LLM provider.
 *
 * <p>Every call falls back to {@link SynthesisFormats#fallback} when the provider
 * is not configured or the call fails.
 */
@Slf4j
public class LlmSynthesisEngine implements SynthesisEngine {

    public static final String NAME = "llm";

    static final int MAX_INPUT_CHARS = 50_000;
    private static final int GAP_DETECTION_MAX_TOKENS = 1000;
    private static final int MAX_DETECTED_GAPS = 5;

    private final LlmService llmService;
    private final String promptTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LlmSynthesisEngine(LlmService llmService, SynthesisProperties properties) {
        this.llmService = llmService;
        this.promptTemplate = loadTemplate(properties.getPromptTemplate());
    }

    @Override
    public String synthesize(String taskId, List<SourceContext> contexts) {
        List<SourceContext> usable = SynthesisFormats.usable(contexts);
        if (usable.isEmpty()) {
            return SynthesisFormats.noContext(taskId);
        }
        if (!llmService.isConfigured()) {
            log.warn("[SYNTHESIS] LLM not configured, using raw context | taskId={} | provider={}",
                taskId, llmService.getProvider());
            return SynthesisFormats.fallback(taskId, contexts);
        }

        long startTime = System.currentTimeMillis();
        String rawData = TextUtils.truncateText(SynthesisFormats.sourceSections(usable), MAX_INPUT_CHARS);
        String prompt = SynthesisPrompts.buildSynthesisPrompt(promptTemplate, taskId, title(usable), rawData);
        try {
            String body = llmService.generateContent(prompt);
            log.info("[SYNTHESIS] Context synthesized | taskId={} | sources={} | inputChars={} | estimatedPromptTokens={} | outputChars={} | durationMs={}",
                taskId, usable.size(), rawData.length(), TextUtils.estimateTokens(prompt), body.length(),
                System.currentTimeMillis() - startTime);
            return body;
        } catch (SynthesisException e) {
            log.warn("[SYNTHESIS] Synthesis failed, using raw context | taskId={} | durationMs={} | error={}",
                taskId, System.currentTimeMillis() - startTime, e.getMessage());
            return SynthesisFormats.fallback(taskId, contexts);
        }
    }

    @Override
    public String refine(String taskId, String draft, List<SourceContext> contexts) {
        if (!llmService.isConfigured() || draft == null || draft.isBlank()) {
            return draft;
        }
        long startTime = System.currentTimeMillis();
        String rawData = TextUtils.truncateText(SynthesisFormats.sourceSections(contexts), MAX_INPUT_CHARS);
        try {
            String refined = llmService.generateContent(SynthesisPrompts.buildRefinementPrompt(taskId, draft, rawData));
            log.info("[SYNTHESIS] Draft refined | taskId={} | draftChars={} | refinedChars={} | durationMs={}",
                taskId, draft.length(), refined.length(), System.currentTimeMillis() - startTime);
            return refined;
        } catch (SynthesisException e) {
            log.warn("[SYNTHESIS] Refinement failed, keeping draft | taskId={} | error={}", taskId, e.getMessage());
            return draft;
        }
    }

    @Override
    public List<String> detectGaps(String body) {
        if (!llmService.isConfigured() || body == null || body.isBlank()) {
            return List.of();
        }
        try {
            String response = llmService.generateJsonContent(
                SynthesisPrompts.buildGapDetectionPrompt(TextUtils.truncateText(body, MAX_INPUT_CHARS)),
                GAP_DETECTION_MAX_TOKENS);
            return parseGaps(response);
        } catch (SynthesisException e) {
            log.warn("[SYNTHESIS] Gap detection failed | error={}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Reads a JSON array of strings, tolerating code fences. Models that ignore
     * the format instruction get their bullet list parsed instead.
     */
    List<String> parseGaps(String response) {
        if (response == null || response.isBlank()) {
            return List.of();
        }
        String text = stripCodeFence(response.strip());
        List<String> gaps = new ArrayList<>();
        if (text.startsWith("[")) {
            try {
                JsonNode root = objectMapper.readTree(text);
                for (JsonNode item : root) {
                    if (item.isTextual() && !item.asText().isBlank()) {
                        gaps.add(item.asText().strip());
                    }
                }
                return limit(gaps);
            } catch (JsonProcessingException e) {
                log.debug("[SYNTHESIS] Gap response is not JSON, reading as list | error={}", e.getOriginalMessage());
            }
        }
        for (String line : text.split("\\R")) {
            String item = line.strip();
            if (item.startsWith("- ") || item.startsWith("* ")) {
                gaps.add(item.substring(2).strip());
            }
        }
        return limit(gaps);
    }

    private static List<String> limit(List<String> gaps) {
        return gaps.size() > MAX_DETECTED_GAPS ? List.copyOf(gaps.subList(0, MAX_DETECTED_GAPS)) : List.copyOf(gaps);
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int lastFence = text.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, lastFence).strip();
    }

    private static String title(List<SourceContext> contexts) {
        return contexts.stream()
            .flatMap(c -> c.dataAs(JiraContext.class).stream())
            .map(JiraContext::getTicket)
            .filter(Objects::nonNull)
            .map(JiraTicket::getTitle)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);
    }

    private static String loadTemplate(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        try {
            String template = Files.readString(Path.of(path), StandardCharsets.UTF_8);
            log.info("[SYNTHESIS] Custom prompt template loaded | path={} | chars={}", path, template.length());
            return template;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read synthesis prompt template " + path + ": " + e.getMessage());
        }
    }
}
