package com.starscape.mediareaper.features.pendingdeletions.api.dto;

import com.starscape.mediareaper.features.pendingdeletions.app.BulkItemOutcome;

import java.util.List;

public record BulkOperationResponse(
    int requested,
    int applied,
    int rejected,
    List<BulkItemOutcome> results
) {
    
    public static BulkOperationResponse from(List<BulkItemOutcome> results) {
        int applied = (int) results.stream()
                .filter(r -> r.outcome() == BulkItemOutcome.Outcome.APPLIED)
                .count();
        return new BulkOperationResponse(results.size(), applied, results.size() - applied, results);
    }
}
