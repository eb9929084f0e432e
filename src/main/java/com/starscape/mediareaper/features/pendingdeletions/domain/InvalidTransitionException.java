package com.starscape.mediareaper.features.pendingdeletions.domain;

import com.starscape.mediareaper.common.exception.ConflictException;

/**
 * The requested lifecycle action is not legal from the item's current status.
 * Status is left unchanged.
 */
public class InvalidTransitionException extends ConflictException {
    
    private final PendingDeletionStatus currentStatus;
    
    public InvalidTransitionException(Long pendingDeletionId, String action, PendingDeletionStatus currentStatus) {
        super("Cannot " + action + " pending deletion " + pendingDeletionId + " in status " + currentStatus);
        this.currentStatus = currentStatus;
    }
    
    public PendingDeletionStatus getCurrentStatus() {
        return currentStatus;
    }
}
