package com.starscape.mediareaper.features.rules.domain;

import com.starscape.mediareaper.features.media.domain.MediaType;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matching-relevant state of a rule. Previews evaluate unsaved definitions through the
 * same type (with a null id), and a pending deletion keeps the snapshot it was proposed with.
 */
public record RuleSnapshot(
    Long ruleId,
    String name,
    Set<MediaType> mediaTypes,
    List<RuleCondition> conditions,
    Map<ConditionGroup, Boolean> filtersEnabled,
    DeletionStrategy deletionStrategy,
    Instant capturedAt
) {
    
    public RuleSnapshot {
        mediaTypes = mediaTypes == null || mediaTypes.isEmpty() ? Set.of() : Set.copyOf(mediaTypes);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        filtersEnabled = filtersEnabled == null ? Map.of() : Map.copyOf(filtersEnabled);
        deletionStrategy = deletionStrategy == null ? DeletionStrategy.defaults() : deletionStrategy;
    }
    
    public boolean groupEnabled(ConditionGroup group) {
        return Boolean.TRUE.equals(filtersEnabled.get(group));
    }
    
    /**
     * Empty target set means every media type.
     */
    public boolean targets(MediaType type) {
        return mediaTypes.isEmpty() || mediaTypes.contains(type);
    }
    
    /**
     * Conditions that take part in matching: their group is enabled and they carry a value.
     */
    public List<RuleCondition> activeConditions() {
        return conditions.stream()
                .filter(c -> groupEnabled(c.kind().group()))
                .filter(RuleCondition::hasValue)
                .toList();
    }
    
    public Set<ConditionGroup> enabledGroups() {
        Set<ConditionGroup> groups = EnumSet.noneOf(ConditionGroup.class);
        filtersEnabled.forEach((group, on) -> {
            if (Boolean.TRUE.equals(on)) {
                groups.add(group);
            }
        });
        return groups;
    }
    
    static Map<ConditionGroup, Boolean> normalizeFilters(Map<ConditionGroup, Boolean> filters) {
        Map<ConditionGroup, Boolean> normalized = new EnumMap<>(ConditionGroup.class);
        for (ConditionGroup group : ConditionGroup.values()) {
            normalized.put(group, filters != null && Boolean.TRUE.equals(filters.get(group)));
        }
        return normalized;
    }
}
