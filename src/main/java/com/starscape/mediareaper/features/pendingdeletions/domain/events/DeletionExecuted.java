package com.starscape.mediareaper.features.pendingdeletions.domain.events;

import com.starscape.mediareaper.common.domain.DomainEvent;

import java.time.Instant;

public record DeletionExecuted(
    Long pendingDeletionId,
    Long mediaId,
    Long ruleId,
    String title,
    long bytesFreed,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "DeletionExecuted";
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
