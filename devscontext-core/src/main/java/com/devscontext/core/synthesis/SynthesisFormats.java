package com.devscontext.core.synthesis;

import com.devscontext.core.model.SourceContext;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Plain-text bodies shared by the engines.
 */
public final class SynthesisFormats {

    static final String SECTION_SEPARATOR = "\n\n---\n\n";

    private SynthesisFormats() {}

    public static String noContext(String taskId) {
        return "## Task: " + taskId + "\n\nNo context found for this task.";
    }

    /** The body served when the LLM could not be used. */
    public static String fallback(String taskId, List<SourceContext> contexts) {
        List<SourceContext> usable = usable(contexts);
        if (usable.isEmpty()) {
            return noContext(taskId);
        }
        return "## Task: " + taskId + "\n\n*Note: LLM synthesis unavailable, showing raw context.*\n\n"
            + usable.stream().map(SourceContext::getRawText).collect(Collectors.joining(SECTION_SEPARATOR));
    }

    static String sourceSections(List<SourceContext> contexts) {
        return usable(contexts).stream()
            .map(c -> "### Source: " + c.getSourceName() + " (" + c.getSourceType().name().toLowerCase(Locale.ROOT) + ")\n\n"
                + c.getRawText())
            .collect(Collectors.joining(SECTION_SEPARATOR));
    }

    static List<SourceContext> usable(List<SourceContext> contexts) {
        return contexts.stream().filter(SourceContext::hasContent).collect(Collectors.toList());
    }
}
