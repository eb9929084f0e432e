package com.starscape.mediareaper.features.history.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of one execution pass. Never updated after insert.
 */
@Entity
@Table(name = "deletion_history")
public class DeletionHistory {
    
    public static final String MULTIPLE_RULES = "Multiple rules";
    public static final String NO_RULE = "No eligible deletions";
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "rule_id", updatable = false)
    private Long ruleId;
    
    @Column(name = "rule_name", nullable = false, updatable = false)
    private String ruleName;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "media_deleted", nullable = false, columnDefinition = "jsonb", updatable = false)
    private List<DeletedMediaSummary> mediaDeleted = new ArrayList<>();
    
    @Column(name = "items_attempted", nullable = false, updatable = false)
    private int itemsAttempted;
    
    @Column(name = "items_succeeded", nullable = false, updatable = false)
    private int itemsSucceeded;
    
    @Column(name = "total_size_freed", nullable = false, updatable = false)
    private long totalSizeFreed;
    
    @Column(nullable = false, updatable = false)
    private boolean success;
    
    @Column(updatable = false)
    private String error;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, updatable = false)
    private ExecutionTrigger trigger;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected DeletionHistory() {
        // JPA constructor
    }
    
    public DeletionHistory(List<DeletedMediaSummary> items, ExecutionTrigger trigger, Instant createdAt) {
        this.mediaDeleted = new ArrayList<>(items);
        this.trigger = trigger;
        this.createdAt = createdAt;
        this.itemsAttempted = items.size();
        this.itemsSucceeded = (int) items.stream().filter(DeletedMediaSummary::success).count();
        this.totalSizeFreed = items.stream().mapToLong(DeletedMediaSummary::bytesFreed).sum();
        this.success = itemsSucceeded == itemsAttempted;
        this.error = items.stream()
                .filter(item -> !item.success())
                .map(DeletedMediaSummary::error)
                .findFirst()
                .orElse(null);
        
        List<Long> ruleIds = items.stream().map(DeletedMediaSummary::ruleId).distinct().toList();
        if (items.isEmpty()) {
            this.ruleId = null;
            this.ruleName = NO_RULE;
        } else if (ruleIds.size() == 1) {
            this.ruleId = ruleIds.get(0);
            this.ruleName = items.get(0).ruleName();
        } else {
            this.ruleId = null;
            this.ruleName = MULTIPLE_RULES;
        }
    }
    
    public Long getId() { return id; }
    public Long getRuleId() { return ruleId; }
    public String getRuleName() { return ruleName; }
    public List<DeletedMediaSummary> getMediaDeleted() { return Collections.unmodifiableList(mediaDeleted); }
    public int getItemsAttempted() { return itemsAttempted; }
    public int getItemsSucceeded() { return itemsSucceeded; }
    public long getTotalSizeFreed() { return totalSizeFreed; }
    public boolean isSuccess() { return success; }
    public String getError() { return error; }
    public ExecutionTrigger getTrigger() { return trigger; }
    public Instant getCreatedAt() { return createdAt; }
}
