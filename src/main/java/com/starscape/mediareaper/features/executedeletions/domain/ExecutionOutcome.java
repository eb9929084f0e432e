package com.starscape.mediareaper.features.executedeletions.domain;

public enum ExecutionOutcome {
    /** Nothing was eligible. */
    EMPTY,
    /** Every attempted item completed. */
    COMPLETED,
    /** Some items completed, some failed. */
    PARTIAL,
    /** Every attempted item failed. */
    FAILED,
    /** Another pass was already running; nothing was done. */
    BUSY
}
