package com.devscontext.core.storage;

import com.devscontext.data.entity.ContextStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PrebuiltSummary {
    String taskId;
    double qualityScore;
    Instant builtAt;
    Instant expiresAt;
    int gapsCount;
    ContextStatus status;
}
