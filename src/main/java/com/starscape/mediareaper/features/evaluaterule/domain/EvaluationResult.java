package com.starscape.mediareaper.features.evaluaterule.domain;

import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.media.domain.WatchStatus;
import com.starscape.mediareaper.features.rules.domain.ConditionGroup;

import java.util.List;
import java.util.Map;

/**
 * Matches of a rule over a media set, largest first, with aggregate counts.
 */
public record EvaluationResult(
    List<MediaSnapshot> matches,
    int evaluatedCount,
    long totalSize,
    Map<MediaType, Long> countsByType,
    Map<WatchStatus, Long> countsByWatchStatus,
    Map<ConditionGroup, Long> excludedByGroup
) {
    
    public int matchedCount() {
        return matches.size();
    }
}
