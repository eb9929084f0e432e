package com.starscape.mediareaper.features.evaluaterule.api.dto;

import com.starscape.mediareaper.features.evaluaterule.domain.EvaluationResult;
import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.media.domain.WatchStatus;
import com.starscape.mediareaper.features.rules.domain.ConditionGroup;

import java.util.List;
import java.util.Map;

public record PreviewResponse(
    List<PreviewItem> matches,
    int evaluatedCount,
    int matchedCount,
    long totalSize,
    Map<MediaType, Long> countsByType,
    Map<WatchStatus, Long> countsByWatchStatus,
    Map<ConditionGroup, Long> excludedByGroup
) {
    
    public static PreviewResponse from(EvaluationResult result) {
        return new PreviewResponse(
            result.matches().stream().map(PreviewItem::from).toList(),
            result.evaluatedCount(),
            result.matchedCount(),
            result.totalSize(),
            result.countsByType(),
            result.countsByWatchStatus(),
            result.excludedByGroup()
        );
    }
}
