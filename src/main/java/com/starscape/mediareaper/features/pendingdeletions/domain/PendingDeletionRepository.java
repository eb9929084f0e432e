package com.starscape.mediareaper.features.pendingdeletions.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PendingDeletionRepository {
    PendingDeletion save(PendingDeletion pendingDeletion);
    Optional<PendingDeletion> findById(Long id);
    List<Long> findMediaIdsByRuleIdAndStatusIn(Long ruleId, Collection<PendingDeletionStatus> statuses);
    List<PendingDeletion> findByRuleId(Long ruleId);
    List<Long> findExecutableIds(Instant now, Instant staleBefore, boolean retryFailed, int maxAttempts);
    Page<PendingDeletion> findAll(Pageable pageable);
    Page<PendingDeletion> findByStatus(PendingDeletionStatus status, Pageable pageable);
    Page<PendingDeletion> findByRuleId(Long ruleId, Pageable pageable);
    Page<PendingDeletion> findByStatusAndRuleId(PendingDeletionStatus status, Long ruleId, Pageable pageable);
    List<StatusTotals> summarizeByStatus();
}
