package com.starscape.mediareaper.common.domain;

import java.time.Instant;

public interface DomainEvent {
    String getEventType();
    String getAggregateId();
    Instant getOccurredOn();
}
