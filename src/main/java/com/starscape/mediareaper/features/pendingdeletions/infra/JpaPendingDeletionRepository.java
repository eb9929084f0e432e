package com.starscape.mediareaper.features.pendingdeletions.infra;

import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionRepository;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus;
import com.starscape.mediareaper.features.pendingdeletions.domain.StatusTotals;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface JpaPendingDeletionRepository extends JpaRepository<PendingDeletion, Long>, PendingDeletionRepository {
    
    @Override
    @Query("SELECT p.mediaId FROM PendingDeletion p WHERE p.ruleId = :ruleId AND p.status IN :statuses")
    List<Long> findMediaIdsByRuleIdAndStatusIn(@Param("ruleId") Long ruleId,
                                               @Param("statuses") Collection<PendingDeletionStatus> statuses);
    
    List<PendingDeletion> findByRuleId(Long ruleId);
    
    Page<PendingDeletion> findByStatus(PendingDeletionStatus status, Pageable pageable);
    
    Page<PendingDeletion> findByRuleId(Long ruleId, Pageable pageable);
    
    Page<PendingDeletion> findByStatusAndRuleId(PendingDeletionStatus status, Long ruleId, Pageable pageable);
    
    @Query("""
            SELECT p.id FROM PendingDeletion p
            WHERE (p.status = com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus.APPROVED
                   OR (p.status = com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus.FAILED
                       AND (p.retryRequested = true OR (:retryFailed = true AND p.attemptCount < :maxAttempts))))
              AND (p.scheduledDate IS NULL OR p.scheduledDate <= :now)
              AND (p.claimedAt IS NULL OR p.claimedAt <= :staleBefore)
            ORDER BY p.id ASC
            """)
    List<Long> findExecutableIds(@Param("now") Instant now,
                                 @Param("staleBefore") Instant staleBefore,
                                 @Param("retryFailed") boolean retryFailed,
                                 @Param("maxAttempts") int maxAttempts);
    
    @Override
    @Query("""
            SELECT new com.starscape.mediareaper.features.pendingdeletions.domain.StatusTotals(
                p.status, COUNT(p), COALESCE(SUM(p.mediaSize), 0L))
            FROM PendingDeletion p
            GROUP BY p.status
            """)
    List<StatusTotals> summarizeByStatus();
}
