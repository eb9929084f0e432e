package com.starscape.mediareaper.features.rules.app;

import com.starscape.mediareaper.common.exception.ValidationException;
import com.starscape.mediareaper.features.evaluaterule.domain.QualityTier;
import com.starscape.mediareaper.features.media.domain.WatchStatus;
import com.starscape.mediareaper.features.rules.domain.ConditionKind;
import com.starscape.mediareaper.features.rules.domain.RuleCondition;
import com.starscape.mediareaper.features.rules.domain.RuleSchedule;
import com.starscape.mediareaper.features.rules.domain.ScheduleFrequency;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rejects malformed rule definitions before anything is stored or evaluated.
 */
@Component
public class RuleValidator {
    
    public void validate(List<RuleCondition> conditions, RuleSchedule schedule) {
        Map<String, String> errors = new LinkedHashMap<>();
        validateConditions(conditions, errors);
        validateSchedule(schedule, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid rule definition", errors);
        }
    }
    
    private void validateConditions(List<RuleCondition> conditions, Map<String, String> errors) {
        if (conditions == null) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < conditions.size(); i++) {
            String field = "conditions[" + i + "]";
            RuleCondition condition = conditions.get(i);
            if (condition == null || condition.kind() == null || condition.operator() == null) {
                errors.put(field, "kind and operator are required");
                continue;
            }
            if (!condition.kind().supports(condition.operator())) {
                errors.put(field, condition.kind() + " does not support " + condition.operator()
                    + ", expected one of " + condition.kind().operators());
                continue;
            }
            if (!seen.add(condition.kind() + "/" + condition.operator())) {
                errors.put(field, "duplicate condition " + condition.kind() + " " + condition.operator());
                continue;
            }
            if (!condition.hasValue()) {
                continue;
            }
            String problem = checkValue(condition);
            if (problem != null) {
                errors.put(field, problem);
            }
        }
    }
    
    private String checkValue(RuleCondition condition) {
        String value = condition.value().trim();
        ConditionKind kind = condition.kind();
        switch (kind.valueType()) {
            case NUMBER -> {
                double number;
                try {
                    number = Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    return kind + " needs a number, got '" + value + "'";
                }
                if (number < 0) {
                    return kind + " cannot be negative";
                }
                if (kind == ConditionKind.RATING && number > 10) {
                    return "RATING must be between 0 and 10";
                }
                if (kind == ConditionKind.WATCH_PERCENTAGE && number > 100) {
                    return "WATCH_PERCENTAGE must be between 0 and 100";
                }
                return null;
            }
            case QUALITY_TIER -> {
                return QualityTier.isKnown(value) ? null : "unknown quality '" + value + "'";
            }
            case WATCH_STATUS -> {
                String normalized = value.replace('-', '_');
                for (WatchStatus status : WatchStatus.values()) {
                    if (status.name().equalsIgnoreCase(normalized)) {
                        return null;
                    }
                }
                return "watch status must be one of watched, unwatched, in_progress";
            }
            case MONITORING -> {
                return "monitored".equalsIgnoreCase(value) || "unmonitored".equalsIgnoreCase(value)
                    ? null
                    : "monitoring status must be monitored or unmonitored";
            }
            default -> {
                return null;
            }
        }
    }
    
    private void validateSchedule(RuleSchedule schedule, Map<String, String> errors) {
        if (schedule == null) {
            return;
        }
        try {
            schedule.timeOfDay();
        } catch (IllegalArgumentException e) {
            errors.put("schedule.time", e.getMessage());
        }
        if (schedule.frequency() == ScheduleFrequency.CUSTOM && schedule.unit() == null) {
            errors.put("schedule.unit", "unit is required for a custom schedule");
        }
    }
}
