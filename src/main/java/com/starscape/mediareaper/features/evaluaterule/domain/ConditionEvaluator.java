package com.starscape.mediareaper.features.evaluaterule.domain;

import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.rules.domain.RuleCondition;

import java.time.Instant;

/**
 * Pure check of one condition against one media snapshot.
 * Implementations return true when the media lacks the data the condition needs,
 * unless the condition is an equality on that data.
 */
@FunctionalInterface
public interface ConditionEvaluator {
    
    boolean test(MediaSnapshot media, RuleCondition condition, Instant now);
}
