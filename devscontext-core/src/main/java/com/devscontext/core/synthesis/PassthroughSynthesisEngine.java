package com.devscontext.core.synthesis;

import com.devscontext.core.model.SourceContext;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Formats each source under its own heading without calling an LLM.
 */
@Slf4j
public class PassthroughSynthesisEngine implements SynthesisEngine {

    public static final String NAME = "passthrough";

    @Override
    public String synthesize(String taskId, List<SourceContext> contexts) {
        if (SynthesisFormats.usable(contexts).isEmpty()) {
            return SynthesisFormats.noContext(taskId);
        }
        String body = "## Task: " + taskId + "\n\n" + SynthesisFormats.sourceSections(contexts);
        log.debug("[SYNTHESIS] Passthrough body built | taskId={} | chars={}", taskId, body.length());
        return body;
    }

    @Override
    public String refine(String taskId, String draft, List<SourceContext> contexts) {
        return draft;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
