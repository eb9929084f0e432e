package com.starscape.mediareaper.features.pendingdeletions.domain.events;

import com.starscape.mediareaper.common.domain.DomainEvent;

import java.time.Instant;
import java.util.List;

/**
 * Published when a rule run created new pending deletions.
 */
public record PendingDeletionsProposed(
    Long ruleId,
    String ruleName,
    List<Long> pendingDeletionIds,
    long totalSize,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "PendingDeletionsProposed";
    }
    
    @Override
    public String getAggregateId() {
        return String.valueOf(ruleId);
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
