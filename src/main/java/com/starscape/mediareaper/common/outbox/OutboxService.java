package com.starscape.mediareaper.common.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.mediareaper.common.domain.AggregateRoot;
import com.starscape.mediareaper.common.domain.DomainEvent;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class OutboxService {
    
    private final OutboxEventRepository outboxRepository;
    private final ObjectMapper objectMapper;
    
    public OutboxService(OutboxEventRepository outboxRepository, ObjectMapper objectMapper) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
    }
    
    /**
     * Write an event to the outbox. Joins the caller's transaction when there is one.
     */
    @Transactional(propagation = Propagation.REQUIRED)
    public void publish(DomainEvent event, String aggregateType) {
        try {
            String eventId = "evt_" + UUID.randomUUID().toString().replace("-", "");
            String payload = objectMapper.writeValueAsString(event);
            
            OutboxEvent outboxEvent = new OutboxEvent(
                eventId,
                aggregateType,
                event.getAggregateId(),
                event.getEventType(),
                payload
            );
            
            outboxRepository.save(outboxEvent);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.getEventType(), e);
        }
    }
    
    /**
     * Drain the events registered on an aggregate into the outbox.
     */
    @Transactional(propagation = Propagation.REQUIRED)
    public void publishAll(AggregateRoot<?> aggregate, String aggregateType) {
        aggregate.getDomainEvents().forEach(event -> publish(event, aggregateType));
        aggregate.clearDomainEvents();
    }
}
