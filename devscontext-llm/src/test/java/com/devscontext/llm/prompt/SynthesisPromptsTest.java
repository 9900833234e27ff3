package com.devscontext.llm.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SynthesisPromptsTest {

    @Test
    void synthesisPromptFillsPlaceholders() {
        String prompt = SynthesisPrompts.buildSynthesisPrompt(null, "PROJ-7", "Retry webhooks", "[jira] raw");

        assertThat(prompt)
            .contains("## Task: PROJ-7 - Retry webhooks")
            .contains("[jira] raw")
            .doesNotContain("{task_id}")
            .doesNotContain("{raw_data}");
    }

    @Test
    void customTemplateReplacesDefault() {
        String prompt = SynthesisPrompts.buildSynthesisPrompt("Task {task_id}: {title}\n{raw_data}", "PROJ-7", null, "data");

        assertThat(prompt).isEqualTo("Task PROJ-7: Untitled\ndata");
    }
}
