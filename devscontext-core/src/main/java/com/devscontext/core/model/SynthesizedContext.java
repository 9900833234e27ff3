package com.devscontext.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class SynthesizedContext {

    String taskId;
    String body;

    @Builder.Default
    List<String> sourcesUsed = List.of();

    double qualityScore;

    @Builder.Default
    List<Gap> gaps = List.of();

    Instant builtAt;

    /** Served from the pre-built store rather than synthesized for this request. */
    boolean prebuilt;
}
