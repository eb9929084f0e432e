package com.starscape.mediareaper.features.pendingdeletions.domain.events;

import com.starscape.mediareaper.common.domain.DomainEvent;

import java.time.Instant;

/**
 * Published when an execution attempt failed. The item stays eligible for retry.
 */
public record DeletionFailed(
    Long pendingDeletionId,
    Long mediaId,
    Long ruleId,
    String title,
    int attemptCount,
    String errorMessage,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "DeletionFailed";
    }
    
    @Override
    public String getAggregateId() {
        return String.valueOf(pendingDeletionId);
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
