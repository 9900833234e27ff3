package com.devscontext.core.orchestrator;

import lombok.Value;

import java.util.Map;

@Value
public class HealthStatus {
    /** True when every adapter is healthy, or none are configured. */
    boolean healthy;
    Map<String, Boolean> adapters;
}
