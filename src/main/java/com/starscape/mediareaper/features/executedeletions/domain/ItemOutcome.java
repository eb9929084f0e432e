package com.starscape.mediareaper.features.executedeletions.domain;

import com.starscape.mediareaper.features.history.domain.DeletedMediaSummary;
import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.pendingdeletions.domain.IntegrationKind;

import java.util.List;

/**
 * What happened to one selected item during an execution pass.
 * SKIPPED items were taken by someone else (cancelled or claimed) before this pass got to them.
 */
public record ItemOutcome(
    Long pendingDeletionId,
    Long mediaId,
    Long ruleId,
    String ruleName,
    String title,
    String filename,
    String path,
    MediaType type,
    long size,
    Status status,
    IntegrationKind integration,
    List<String> actions,
    long bytesFreed,
    String error
) {
    
    public enum Status {
        COMPLETED,
        FAILED,
        SKIPPED
    }
    
    public static ItemOutcome skipped(Long pendingDeletionId, String reason) {
        return new ItemOutcome(pendingDeletionId, null, null, null, null, null, null, null, 0L,
            Status.SKIPPED, null, List.of(), 0L, reason);
    }
    
    public boolean attempted() {
        return status != Status.SKIPPED;
    }
    
    public DeletedMediaSummary toSummary() {
        return new DeletedMediaSummary(pendingDeletionId, mediaId, ruleId, ruleName, title, filename, path,
            type, size, status == Status.COMPLETED, bytesFreed, error);
    }
}
