package com.starscape.mediareaper.features.rules.domain;

import com.starscape.mediareaper.common.domain.AggregateRoot;
import com.starscape.mediareaper.features.media.domain.MediaType;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persisted deletion policy. Live state is configuration only; pending deletions work
 * from the {@link RuleSnapshot} taken when they were proposed.
 */
@Entity
@Table(name = "deletion_rules")
public class DeletionRule extends AggregateRoot<Long> {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false)
    private String name;
    
    private String description;
    
    @Column(nullable = false)
    private boolean enabled;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "media_types", nullable = false, columnDefinition = "jsonb")
    private Set<MediaType> mediaTypes = new LinkedHashSet<>();
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private List<RuleCondition> conditions = new ArrayList<>();
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "filters_enabled", nullable = false, columnDefinition = "jsonb")
    private Map<ConditionGroup, Boolean> filtersEnabled = new HashMap<>();
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "deletion_strategy", nullable = false, columnDefinition = "jsonb")
    private DeletionStrategy deletionStrategy;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private RuleSchedule schedule;
    
    @Column(name = "last_run")
    private Instant lastRun;
    
    @Column(name = "next_run")
    private Instant nextRun;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected DeletionRule() {
        // JPA constructor
    }
    
    public DeletionRule(String name, String description, boolean enabled, Set<MediaType> mediaTypes,
                        List<RuleCondition> conditions, Map<ConditionGroup, Boolean> filtersEnabled,
                        DeletionStrategy deletionStrategy, RuleSchedule schedule,
                        Instant now, ZoneId zone) {
        this.createdAt = now;
        apply(name, description, enabled, mediaTypes, conditions, filtersEnabled, deletionStrategy, schedule, now, zone);
    }
    
    /**
     * Replace the definition. Pending deletions already proposed keep their snapshots.
     */
    public void update(String name, String description, boolean enabled, Set<MediaType> mediaTypes,
                       List<RuleCondition> conditions, Map<ConditionGroup, Boolean> filtersEnabled,
                       DeletionStrategy deletionStrategy, RuleSchedule schedule,
                       Instant now, ZoneId zone) {
        apply(name, description, enabled, mediaTypes, conditions, filtersEnabled, deletionStrategy, schedule, now, zone);
    }
    
    private void apply(String name, String description, boolean enabled, Set<MediaType> mediaTypes,
                       List<RuleCondition> conditions, Map<ConditionGroup, Boolean> filtersEnabled,
                       DeletionStrategy deletionStrategy, RuleSchedule schedule,
                       Instant now, ZoneId zone) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name cannot be blank");
        }
        this.name = name.trim();
        this.description = description;
        this.enabled = enabled;
        this.mediaTypes = mediaTypes == null || mediaTypes.isEmpty()
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(EnumSet.copyOf(mediaTypes));
        this.conditions = conditions == null ? new ArrayList<>() : new ArrayList<>(conditions);
        this.filtersEnabled = new HashMap<>(RuleSnapshot.normalizeFilters(filtersEnabled));
        this.deletionStrategy = deletionStrategy == null ? DeletionStrategy.defaults() : deletionStrategy;
        this.schedule = schedule == null ? RuleSchedule.manual() : schedule;
        this.updatedAt = now;
        rescheduleFrom(now, zone);
    }
    
    /**
     * Record a proposal run and move the next automatic run one period ahead.
     */
    public void markRun(Instant now, ZoneId zone) {
        this.lastRun = now;
        this.updatedAt = now;
        rescheduleFrom(now, zone);
    }
    
    /**
     * Move the next automatic run one period ahead without recording a run.
     */
    public void postponeAfter(Instant now, ZoneId zone) {
        this.updatedAt = now;
        rescheduleFrom(now, zone);
    }
    
    private void rescheduleFrom(Instant now, ZoneId zone) {
        this.nextRun = enabled ? schedule.nextRunAfter(now, zone).orElse(null) : null;
    }
    
    public RuleSnapshot toSnapshot(Instant capturedAt) {
        return new RuleSnapshot(id, name, mediaTypes, conditions, filtersEnabled, deletionStrategy, capturedAt);
    }
    
    @Override
    public Long getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public boolean isEnabled() { return enabled; }
    public Set<MediaType> getMediaTypes() { return mediaTypes; }
    public List<RuleCondition> getConditions() { return conditions; }
    public Map<ConditionGroup, Boolean> getFiltersEnabled() { return filtersEnabled; }
    public DeletionStrategy getDeletionStrategy() { return deletionStrategy; }
    public RuleSchedule getSchedule() { return schedule; }
    public Instant getLastRun() { return lastRun; }
    public Instant getNextRun() { return nextRun; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
