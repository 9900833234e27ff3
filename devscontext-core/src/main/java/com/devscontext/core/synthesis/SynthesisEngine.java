package com.devscontext.core.synthesis;

import com.devscontext.core.model.SourceContext;

import java.util.List;

/**
 * Turns fetched source contexts into one markdown body.
 *
 * <p>Implementations fail soft: when generation is unavailable they return a
 * concatenation of the raw source text instead of throwing.
 */
public interface SynthesisEngine {

    String synthesize(String taskId, List<SourceContext> contexts);

    /**
     * Second pass over a draft, tightening structure and source citations.
     * Returns the draft unchanged when refinement is not possible.
     */
    String refine(String taskId, String draft, List<SourceContext> contexts);

    /** Extra gaps spotted in a synthesized body. Empty when unsupported. */
    default List<String> detectGaps(String body) {
        return List.of();
    }

    String getName();
}
