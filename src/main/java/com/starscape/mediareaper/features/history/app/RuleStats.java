package com.starscape.mediareaper.features.history.app;

import java.time.Instant;

/**
 * Deletion totals of one rule across all recorded execution passes.
 */
public record RuleStats(
    Long ruleId,
    String ruleName,
    long executions,
    long itemsDeleted,
    long itemsFailed,
    long bytesFreed,
    Instant lastExecutedAt
) {}
