package com.devscontext.core.storage;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PrebuiltStats {
    long total;
    long active;
    long expired;
    long stale;
    /** Null when the store is empty. */
    Double avgQuality;
    Instant lastBuild;
}
