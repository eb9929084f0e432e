package com.starscape.mediareaper.common.outbox;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import java.time.Instant;

/**
 * Domain event persisted in the same transaction as the state change that produced it.
 * The notification subsystem consumes unprocessed rows and marks them processed.
 */
@Entity
@Table(name = "outbox_events")
public class OutboxEvent {
    
    @Id
    @Column(name = "event_id")
    private String eventId;
    
    @Column(name = "aggregate_type", nullable = false)
    private String aggregateType;
    
    @Column(name = "aggregate_id", nullable = false)
    private String aggregateId;
    
    @Column(name = "event_type", nullable = false)
    private String eventType;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private String payload;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "processed_at")
    private Instant processedAt;
    
    protected OutboxEvent() {
        // JPA constructor
    }
    
    public OutboxEvent(String eventId, String aggregateType, String aggregateId, 
                       String eventType, String payload) {
        this.eventId = eventId;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.eventType = eventType;
        this.payload = payload;
        this.createdAt = Instant.now();
    }
    
    public String getEventId() { return eventId; }
    public String getAggregateType() { return aggregateType; }
    public String getAggregateId() { return aggregateId; }
    public String getEventType() { return eventType; }
    public String getPayload() { return payload; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getProcessedAt() { return processedAt; }
    
    public void markProcessed() {
        this.processedAt = Instant.now();
    }
    
    public boolean isProcessed() {
        return processedAt != null;
    }
}
