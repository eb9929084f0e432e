package com.starscape.mediareaper.features.pendingdeletions.api.dto;

import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.pendingdeletions.domain.ExecutionResult;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus;
import com.starscape.mediareaper.features.rules.domain.RuleSnapshot;

import java.time.Instant;
import java.util.List;

public record PendingDeletionResponse(
    Long id,
    Long mediaId,
    Long ruleId,
    String ruleName,
    PendingDeletionStatus status,
    Instant scheduledDate,
    String approvedBy,
    Instant approvedAt,
    String approvalReason,
    String cancelledBy,
    Instant cancelledAt,
    String cancellationReason,
    String resubmittedBy,
    Instant resubmittedAt,
    Instant completedAt,
    long mediaSize,
    int attemptCount,
    String error,
    MediaSnapshot mediaSnapshot,
    RuleSnapshot ruleSnapshot,
    List<ExecutionResult> executionResults,
    Instant createdAt,
    Instant updatedAt
) {
    
    public static PendingDeletionResponse from(PendingDeletion item) {
        return new PendingDeletionResponse(
            item.getId(),
            item.getMediaId(),
            item.getRuleId(),
            item.getRuleSnapshot().name(),
            item.getStatus(),
            item.getScheduledDate(),
            item.getApprovedBy(),
            item.getApprovedAt(),
            item.getApprovalReason(),
            item.getCancelledBy(),
            item.getCancelledAt(),
            item.getCancellationReason(),
            item.getResubmittedBy(),
            item.getResubmittedAt(),
            item.getCompletedAt(),
            item.getMediaSize(),
            item.getAttemptCount(),
            item.getError(),
            item.getMediaSnapshot(),
            item.getRuleSnapshot(),
            List.copyOf(item.getExecutionResults()),
            item.getCreatedAt(),
            item.getUpdatedAt()
        );
    }
}
