package com.starscape.mediareaper.features.executedeletions.app;

import com.starscape.mediareaper.features.executedeletions.domain.ExecutionSummary;

import java.time.Instant;

public record ExecutionStatus(
    boolean running,
    boolean scheduled,
    Integer intervalMinutes,
    Instant lastRunAt,
    Instant nextRunAt,
    String lastError,
    ExecutionSummary lastSummary
) {}
