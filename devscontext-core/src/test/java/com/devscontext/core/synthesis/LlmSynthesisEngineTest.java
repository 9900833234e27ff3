package com.devscontext.core.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.devscontext.common.exception.ConfigurationException;
import com.devscontext.common.exception.SynthesisException;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.support.Fixtures;
import com.devscontext.llm.config.SynthesisProperties;
import com.devscontext.llm.service.LlmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class LlmSynthesisEngineTest {

    private final LlmService llmService = mock(LlmService.class);
    private final SynthesisProperties properties = new SynthesisProperties();
    private final List<SourceContext> contexts = List.of(
        Fixtures.paymentsTicket("PROJ-1"),
        SourceContext.failure("slack", SourceType.COMMUNICATION, "rate limited", null));

    @BeforeEach
    void setUp() {
        when(llmService.isConfigured()).thenReturn(true);
    }

    @Test
    void promptCarriesTitleAndSourceSections() {
        when(llmService.generateContent(anyString())).thenReturn("## Task: PROJ-1 - synthesized");
        LlmSynthesisEngine engine = new LlmSynthesisEngine(llmService, properties);

        String body = engine.synthesize("PROJ-1", contexts);

        assertEquals("## Task: PROJ-1 - synthesized", body);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).generateContent(prompt.capture());
        assertThat(prompt.getValue())
            .contains("PROJ-1 - Add retry logic to payment webhook handler")
            .contains("### Source: jira (issue_tracker)")
            .doesNotContain("rate limited");
    }

    @Test
    void providerFailureFallsBackToRawContext() {
        when(llmService.generateContent(anyString())).thenThrow(new SynthesisException("Failed to generate content: 429"));
        LlmSynthesisEngine engine = new LlmSynthesisEngine(llmService, properties);

        String body = engine.synthesize("PROJ-1", contexts);

        assertThat(body).isEqualTo("## Task: PROJ-1\n\n*Note: LLM synthesis unavailable, showing raw context.*\n\n"
            + "# [PROJ-1] Add retry logic to payment webhook handler");
    }

    @Test
    void unconfiguredProviderSkipsTheCall() {
        when(llmService.isConfigured()).thenReturn(false);
        LlmSynthesisEngine engine = new LlmSynthesisEngine(llmService, properties);

        assertThat(engine.synthesize("PROJ-1", contexts)).contains("LLM synthesis unavailable");
        verify(llmService, never()).generateContent(anyString());
    }

    @Test
    void noUsableSourcesGivesNoContextBody() {
        LlmSynthesisEngine engine = new LlmSynthesisEngine(llmService, properties);

        assertEquals("## Task: PROJ-9\n\nNo context found for this task.",
            engine.synthesize("PROJ-9", List.of(SourceContext.failure("jira", SourceType.ISSUE_TRACKER, "404", null))));
    }

    @Test
    void refinementFailureKeepsDraft() {
        when(llmService.generateContent(anyString())).thenThrow(new SynthesisException("timeout"));
        LlmSynthesisEngine engine = new LlmSynthesisEngine(llmService, properties);

        assertEquals("draft", engine.refine("PROJ-1", "draft", contexts));
    }

    @Test
    void detectsGapsFromJsonArray() {
        when(llmService.generateJsonContent(anyString(), anyInt()))
            .thenReturn("```json\n[\"No rollback plan\", \"Unclear retry limits\"]\n```");
        LlmSynthesisEngine engine = new LlmSynthesisEngine(llmService, properties);

        assertThat(engine.detectGaps("## Task: PROJ-1")).containsExactly("No rollback plan", "Unclear retry limits");
    }

    @Test
    void parsesBulletListWhenModelIgnoresFormat() {
        LlmSynthesisEngine engine = new LlmSynthesisEngine(llmService, properties);

        assertThat(engine.parseGaps("Here are the gaps:\n- No rollback plan\n* Missing owner"))
            .containsExactly("No rollback plan", "Missing owner");
        assertThat(engine.parseGaps("[not json")).isEmpty();
    }

    @Test
    void gapDetectionFailureIsIgnored() {
        when(llmService.generateJsonContent(anyString(), anyInt())).thenThrow(new SynthesisException("boom"));
        LlmSynthesisEngine engine = new LlmSynthesisEngine(llmService, properties);

        assertThat(engine.detectGaps("body")).isEmpty();
    }

    @Test
    void customTemplateIsLoadedFromFile(@TempDir Path dir) throws Exception {
        Path template = dir.resolve("prompt.md");
        Files.writeString(template, "Summarize {task_id} ({title}):\n{raw_data}");
        properties.setPromptTemplate(template.toString());
        when(llmService.generateContent(anyString())).thenReturn("ok");
        LlmSynthesisEngine engine = new LlmSynthesisEngine(llmService, properties);

        engine.synthesize("PROJ-1", contexts);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).generateContent(prompt.capture());
        assertThat(prompt.getValue()).startsWith("Summarize PROJ-1 (Add retry logic to payment webhook handler):");
    }

    @Test
    void missingTemplateFailsAtStartup(@TempDir Path dir) {
        properties.setPromptTemplate(dir.resolve("missing.md").toString());

        assertThrows(ConfigurationException.class, () -> new LlmSynthesisEngine(llmService, properties));
    }
}
