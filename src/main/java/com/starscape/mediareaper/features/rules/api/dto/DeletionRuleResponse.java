package com.starscape.mediareaper.features.rules.api.dto;

import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.rules.domain.ConditionGroup;
import com.starscape.mediareaper.features.rules.domain.DeletionRule;
import com.starscape.mediareaper.features.rules.domain.DeletionStrategy;
import com.starscape.mediareaper.features.rules.domain.RuleCondition;
import com.starscape.mediareaper.features.rules.domain.RuleSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record DeletionRuleResponse(
    Long id,
    String name,
    String description,
    boolean enabled,
    Set<MediaType> mediaTypes,
    List<RuleCondition> conditions,
    Map<ConditionGroup, Boolean> filtersEnabled,
    DeletionStrategy deletionStrategy,
    RuleSchedule schedule,
    Instant lastRun,
    Instant nextRun,
    Instant createdAt,
    Instant updatedAt
) {
    
    public static DeletionRuleResponse from(DeletionRule rule) {
        return new DeletionRuleResponse(
            rule.getId(),
            rule.getName(),
            rule.getDescription(),
            rule.isEnabled(),
            Set.copyOf(rule.getMediaTypes()),
            List.copyOf(rule.getConditions()),
            Map.copyOf(rule.getFiltersEnabled()),
            rule.getDeletionStrategy(),
            rule.getSchedule(),
            rule.getLastRun(),
            rule.getNextRun(),
            rule.getCreatedAt(),
            rule.getUpdatedAt()
        );
    }
}
