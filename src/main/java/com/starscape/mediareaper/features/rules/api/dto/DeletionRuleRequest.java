package com.starscape.mediareaper.features.rules.api.dto;

import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.rules.domain.ConditionGroup;
import com.starscape.mediareaper.features.rules.domain.DeletionStrategy;
import com.starscape.mediareaper.features.rules.domain.RuleCondition;
import com.starscape.mediareaper.features.rules.domain.RuleSchedule;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Body of rule create, update and preview requests.
 */
public record DeletionRuleRequest(
    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    String name,
    String description,
    Boolean enabled,
    Set<MediaType> mediaTypes,
    List<RuleCondition> conditions,
    Map<ConditionGroup, Boolean> filtersEnabled,
    DeletionStrategy deletionStrategy,
    RuleSchedule schedule
) {
    
    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }
}
