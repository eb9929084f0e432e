package com.starscape.mediareaper.features.pendingdeletions.api.dto;

import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus;
import com.starscape.mediareaper.features.pendingdeletions.domain.StatusTotals;

import java.util.Map;

public record PendingDeletionSummaryResponse(
    Map<PendingDeletionStatus, StatusTotals> byStatus,
    long totalCount,
    long totalSize
) {
    
    public static PendingDeletionSummaryResponse from(Map<PendingDeletionStatus, StatusTotals> byStatus) {
        long count = byStatus.values().stream().mapToLong(StatusTotals::count).sum();
        long size = byStatus.values().stream().mapToLong(StatusTotals::totalSize).sum();
        return new PendingDeletionSummaryResponse(byStatus, count, size);
    }
}
