package com.starscape.mediareaper.features.executedeletions.domain;

import com.starscape.mediareaper.features.history.domain.ExecutionTrigger;

import java.time.Instant;
import java.util.List;

public record ExecutionSummary(
    ExecutionOutcome outcome,
    ExecutionTrigger trigger,
    int totalItems,
    int successful,
    int failed,
    int skipped,
    long bytesFreed,
    Instant startedAt,
    Instant finishedAt,
    Long historyId,
    List<ItemOutcome> items
) {
    
    public static ExecutionSummary busy(ExecutionTrigger trigger, Instant at) {
        return new ExecutionSummary(ExecutionOutcome.BUSY, trigger, 0, 0, 0, 0, 0L, at, at, null, List.of());
    }
    
    public static ExecutionSummary of(ExecutionTrigger trigger, List<ItemOutcome> items,
                                      Instant startedAt, Instant finishedAt, Long historyId) {
        int successful = 0;
        int failed = 0;
        int skipped = 0;
        long bytesFreed = 0;
        for (ItemOutcome item : items) {
            switch (item.status()) {
                case COMPLETED -> {
                    successful++;
                    bytesFreed += item.bytesFreed();
                }
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        ExecutionOutcome outcome;
        if (successful + failed == 0) {
            outcome = ExecutionOutcome.EMPTY;
        } else if (failed == 0) {
            outcome = ExecutionOutcome.COMPLETED;
        } else if (successful == 0) {
            outcome = ExecutionOutcome.FAILED;
        } else {
            outcome = ExecutionOutcome.PARTIAL;
        }
        return new ExecutionSummary(outcome, trigger, successful + failed, successful, failed, skipped,
            bytesFreed, startedAt, finishedAt, historyId, List.copyOf(items));
    }
}
