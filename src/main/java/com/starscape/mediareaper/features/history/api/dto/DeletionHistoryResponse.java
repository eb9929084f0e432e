package com.starscape.mediareaper.features.history.api.dto;

import com.starscape.mediareaper.features.history.domain.DeletedMediaSummary;
import com.starscape.mediareaper.features.history.domain.DeletionHistory;
import com.starscape.mediareaper.features.history.domain.ExecutionTrigger;

import java.time.Instant;
import java.util.List;

public record DeletionHistoryResponse(
    Long id,
    Long ruleId,
    String ruleName,
    List<DeletedMediaSummary> mediaDeleted,
    int itemsAttempted,
    int itemsSucceeded,
    long totalSizeFreed,
    boolean success,
    String error,
    ExecutionTrigger trigger,
    Instant createdAt
) {
    
    public static DeletionHistoryResponse from(DeletionHistory history) {
        return new DeletionHistoryResponse(
            history.getId(),
            history.getRuleId(),
            history.getRuleName(),
            List.copyOf(history.getMediaDeleted()),
            history.getItemsAttempted(),
            history.getItemsSucceeded(),
            history.getTotalSizeFreed(),
            history.isSuccess(),
            history.getError(),
            history.getTrigger(),
            history.getCreatedAt()
        );
    }
}
