package com.starscape.mediareaper.features.history.domain.events;

import com.starscape.mediareaper.common.domain.DomainEvent;
import com.starscape.mediareaper.features.history.domain.ExecutionTrigger;

import java.time.Instant;

public record DeletionBatchCompleted(
    Long historyId,
    ExecutionTrigger trigger,
    int itemsAttempted,
    int itemsSucceeded,
    long totalSizeFreed,
    String error,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "DeletionBatchCompleted";
    }
    
    @Override
    public String getAggregateId() {
        return String.valueOf(historyId);
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
