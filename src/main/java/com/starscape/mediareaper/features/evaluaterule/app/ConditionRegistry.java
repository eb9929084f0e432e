package com.starscape.mediareaper.features.evaluaterule.app;

import com.starscape.mediareaper.features.evaluaterule.domain.ConditionEvaluator;
import com.starscape.mediareaper.features.evaluaterule.domain.ConditionEvaluators;
import com.starscape.mediareaper.features.rules.domain.ConditionKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Dispatch table from condition kind to evaluator. Every kind must have an entry.
 */
@Component
public class ConditionRegistry {
    
    private final Map<ConditionKind, ConditionEvaluator> evaluators = new EnumMap<>(ConditionKind.class);
    
    public ConditionRegistry() {
        register(ConditionKind.AGE_DAYS, ConditionEvaluators::ageDays);
        register(ConditionKind.RATING, ConditionEvaluators::rating);
        register(ConditionKind.QUALITY_TIER, ConditionEvaluators::qualityTier);
        register(ConditionKind.RESOLUTION, ConditionEvaluators::resolution);
        register(ConditionKind.QUALITY_PROFILE, ConditionEvaluators::qualityProfile);
        register(ConditionKind.SIZE_GB, ConditionEvaluators::sizeGb);
        register(ConditionKind.WATCH_STATUS, ConditionEvaluators::watchStatus);
        register(ConditionKind.TITLE, ConditionEvaluators::title);
        register(ConditionKind.SERIES_STATUS, ConditionEvaluators::seriesStatus);
        register(ConditionKind.NETWORK, ConditionEvaluators::network);
        register(ConditionKind.MONITORING_STATUS, ConditionEvaluators::monitoringStatus);
        register(ConditionKind.DOWNLOAD_STATUS, ConditionEvaluators::downloadStatus);
        register(ConditionKind.TAGS, ConditionEvaluators::tags);
        register(ConditionKind.VIEW_COUNT, ConditionEvaluators::viewCount);
        register(ConditionKind.DAYS_SINCE_LAST_WATCHED, ConditionEvaluators::daysSinceLastWatched);
        register(ConditionKind.WATCH_PERCENTAGE, ConditionEvaluators::watchPercentage);
        
        for (ConditionKind kind : ConditionKind.values()) {
            if (!evaluators.containsKey(kind)) {
                throw new IllegalStateException("No evaluator registered for condition kind " + kind);
            }
        }
    }
    
    public final void register(ConditionKind kind, ConditionEvaluator evaluator) {
        evaluators.put(kind, evaluator);
    }
    
    public ConditionEvaluator evaluatorFor(ConditionKind kind) {
        return evaluators.get(kind);
    }
}
