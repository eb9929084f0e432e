package com.starscape.mediareaper.features.pendingdeletions.domain;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one execution attempt. Appended, never rewritten.
 */
public record ExecutionResult(
    Instant attemptedAt,
    boolean success,
    IntegrationKind integration,
    List<String> actions,
    long bytesFreed,
    String error
) {
    
    public ExecutionResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
    
    public static ExecutionResult succeeded(Instant at, IntegrationKind integration, List<String> actions, long bytesFreed) {
        return new ExecutionResult(at, true, integration, actions, bytesFreed, null);
    }
    
    public static ExecutionResult failed(Instant at, IntegrationKind integration, String error) {
        return new ExecutionResult(at, false, integration, List.of(), 0L, error);
    }
}
