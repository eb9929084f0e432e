package com.starscape.mediareaper.features.pendingdeletions.domain;

import com.starscape.mediareaper.common.domain.AggregateRoot;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.pendingdeletions.domain.events.DeletionExecuted;
import com.starscape.mediareaper.features.pendingdeletions.domain.events.DeletionFailed;
import com.starscape.mediareaper.features.rules.domain.RuleSnapshot;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Proposed deletion of one media item by one rule.
 * <p>
 * PENDING → APPROVED | CANCELLED, APPROVED → CANCELLED | COMPLETED | FAILED.
 * FAILED items are picked up again by later execution passes. Completion and failure are
 * only recorded by the execution engine, which holds a lease ({@code claimedAt}) while it works.
 */
@Entity
@Table(name = "pending_deletions")
public class PendingDeletion extends AggregateRoot<Long> {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "media_id", nullable = false)
    private Long mediaId;
    
    @Column(name = "rule_id")
    private Long ruleId;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PendingDeletionStatus status;
    
    @Column(name = "scheduled_date")
    private Instant scheduledDate;
    
    @Column(name = "approved_by")
    private String approvedBy;
    
    @Column(name = "approved_at")
    private Instant approvedAt;
    
    @Column(name = "approval_reason")
    private String approvalReason;
    
    @Column(name = "cancelled_by")
    private String cancelledBy;
    
    @Column(name = "cancelled_at")
    private Instant cancelledAt;
    
    @Column(name = "cancellation_reason")
    private String cancellationReason;
    
    @Column(name = "completed_at")
    private Instant completedAt;
    
    @Column(name = "media_size", nullable = false)
    private long mediaSize;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "media_snapshot", nullable = false, columnDefinition = "jsonb", updatable = false)
    private MediaSnapshot mediaSnapshot;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "rule_snapshot", nullable = false, columnDefinition = "jsonb", updatable = false)
    private RuleSnapshot ruleSnapshot;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_results", nullable = false, columnDefinition = "jsonb")
    private List<ExecutionResult> executionResults = new ArrayList<>();
    
    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;
    
    @Column(name = "error")
    private String error;
    
    @Column(name = "retry_requested", nullable = false)
    private boolean retryRequested;
    
    @Column(name = "resubmitted_by")
    private String resubmittedBy;
    
    @Column(name = "resubmitted_at")
    private Instant resubmittedAt;
    
    @Column(name = "claimed_at")
    private Instant claimedAt;
    
    @Version
    private long version;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected PendingDeletion() {
        // JPA constructor
    }
    
    public PendingDeletion(MediaSnapshot mediaSnapshot, RuleSnapshot ruleSnapshot, Instant now) {
        if (mediaSnapshot == null || mediaSnapshot.id() == null) {
            throw new IllegalArgumentException("Media snapshot must reference a stored media item");
        }
        if (ruleSnapshot == null || ruleSnapshot.ruleId() == null) {
            throw new IllegalArgumentException("Rule snapshot must reference a stored rule");
        }
        this.mediaId = mediaSnapshot.id();
        this.ruleId = ruleSnapshot.ruleId();
        this.mediaSnapshot = mediaSnapshot;
        this.ruleSnapshot = ruleSnapshot;
        this.mediaSize = mediaSnapshot.size();
        this.status = PendingDeletionStatus.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
    }
    
    public void approve(String actor, Instant scheduledDate, String reason, Instant now) {
        if (status != PendingDeletionStatus.PENDING) {
            throw new InvalidTransitionException(id, "approve", status);
        }
        this.status = PendingDeletionStatus.APPROVED;
        this.approvedBy = actor;
        this.approvedAt = now;
        this.approvalReason = reason;
        this.scheduledDate = scheduledDate != null ? scheduledDate : now;
        this.updatedAt = now;
    }
    
    public void cancel(String actor, String reason, Instant now, Duration leaseTimeout) {
        if (!status.isActive()) {
            throw new InvalidTransitionException(id, "cancel", status);
        }
        if (isLeased(now, leaseTimeout)) {
            throw new InvalidTransitionException(id, "cancel (execution in progress)", status);
        }
        this.status = PendingDeletionStatus.CANCELLED;
        this.cancelledBy = actor;
        this.cancelledAt = now;
        this.cancellationReason = reason;
        this.updatedAt = now;
    }
    
    /**
     * Put a failed item back in line for the next pass. Identity and snapshots are kept.
     */
    public void resubmit(String actor, Instant now) {
        if (status != PendingDeletionStatus.FAILED) {
            throw new InvalidTransitionException(id, "resubmit", status);
        }
        this.attemptCount = 0;
        this.retryRequested = true;
        this.resubmittedBy = actor;
        this.resubmittedAt = now;
        this.scheduledDate = now;
        this.updatedAt = now;
    }
    
    /**
     * Whether an execution pass may take this item now.
     */
    public boolean isExecutable(Instant now, Duration leaseTimeout, boolean retryFailed, int maxAttempts) {
        boolean statusOk = status == PendingDeletionStatus.APPROVED
                || (status == PendingDeletionStatus.FAILED
                    && (retryRequested || (retryFailed && attemptCount < maxAttempts)));
        boolean due = scheduledDate == null || !scheduledDate.isAfter(now);
        return statusOk && due && !isLeased(now, leaseTimeout);
    }
    
    public boolean isLeased(Instant now, Duration leaseTimeout) {
        return claimedAt != null && claimedAt.plus(leaseTimeout).isAfter(now);
    }
    
    public void claim(Instant now) {
        this.claimedAt = now;
        this.updatedAt = now;
    }
    
    public void recordSuccess(ExecutionResult result) {
        requireClaimed();
        appendResult(result);
        this.status = PendingDeletionStatus.COMPLETED;
        this.completedAt = result.attemptedAt();
        this.error = null;
        this.claimedAt = null;
        this.updatedAt = result.attemptedAt();
        registerEvent(new DeletionExecuted(id, mediaId, ruleId, mediaSnapshot.displayTitle(),
            result.bytesFreed(), result.attemptedAt()));
    }
    
    public void recordFailure(ExecutionResult result) {
        requireClaimed();
        appendResult(result);
        this.status = PendingDeletionStatus.FAILED;
        this.error = result.error();
        this.claimedAt = null;
        this.updatedAt = result.attemptedAt();
        registerEvent(new DeletionFailed(id, mediaId, ruleId, mediaSnapshot.displayTitle(),
            attemptCount, result.error(), result.attemptedAt()));
    }
    
    private void appendResult(ExecutionResult result) {
        List<ExecutionResult> results = new ArrayList<>(executionResults);
        results.add(result);
        this.executionResults = results;
        this.attemptCount++;
        this.retryRequested = false;
    }
    
    private void requireClaimed() {
        if (claimedAt == null) {
            throw new IllegalStateException("Pending deletion " + id + " was not claimed for execution");
        }
    }
    
    /**
     * Called when the owning rule is deleted; the snapshot keeps the rule readable.
     */
    public void detachRule() {
        this.ruleId = null;
    }
    
    @Override
    public Long getId() { return id; }
    public Long getMediaId() { return mediaId; }
    public Long getRuleId() { return ruleId; }
    public PendingDeletionStatus getStatus() { return status; }
    public Instant getScheduledDate() { return scheduledDate; }
    public String getApprovedBy() { return approvedBy; }
    public Instant getApprovedAt() { return approvedAt; }
    public String getApprovalReason() { return approvalReason; }
    public String getCancelledBy() { return cancelledBy; }
    public Instant getCancelledAt() { return cancelledAt; }
    public String getCancellationReason() { return cancellationReason; }
    public Instant getCompletedAt() { return completedAt; }
    public long getMediaSize() { return mediaSize; }
    public MediaSnapshot getMediaSnapshot() { return mediaSnapshot; }
    public RuleSnapshot getRuleSnapshot() { return ruleSnapshot; }
    public List<ExecutionResult> getExecutionResults() { return Collections.unmodifiableList(executionResults); }
    public int getAttemptCount() { return attemptCount; }
    public boolean isRetryRequested() { return retryRequested; }
    public String getResubmittedBy() { return resubmittedBy; }
    public Instant getResubmittedAt() { return resubmittedAt; }
    public String getError() { return error; }
    public Instant getClaimedAt() { return claimedAt; }
    public long getVersion() { return version; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
