package com.starscape.mediareaper.features.pendingdeletions.app;

import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus;

/**
 * Result of one item of a bulk approve or cancel.
 */
public record BulkItemOutcome(
    Long id,
    Outcome outcome,
    PendingDeletionStatus status,
    String message
) {
    
    public enum Outcome {
        APPLIED,
        NOT_FOUND,
        CONFLICT,
        /** Unexpected failure on this item; the others are still attempted. */
        ERROR
    }
    
    public static BulkItemOutcome applied(Long id, PendingDeletionStatus status) {
        return new BulkItemOutcome(id, Outcome.APPLIED, status, null);
    }
    
    public static BulkItemOutcome notFound(Long id, String message) {
        return new BulkItemOutcome(id, Outcome.NOT_FOUND, null, message);
    }
    
    public static BulkItemOutcome conflict(Long id, String message) {
        return new BulkItemOutcome(id, Outcome.CONFLICT, null, message);
    }
    
    public static BulkItemOutcome error(Long id, String message) {
        return new BulkItemOutcome(id, Outcome.ERROR, null, message);
    }
}
