package com.starscape.mediareaper.features.pendingdeletions.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.common.exception.ConflictException;
import com.starscape.mediareaper.common.exception.NotFoundException;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Function;

/**
 * Operator transitions of pending deletions: approve, cancel and resubmit.
 * <p>
 * Each transition is a versioned read-check-write, so a concurrent change makes the
 * losing write fail with a conflict instead of overwriting. Bulk variants run every id
 * in its own transaction and report per-item outcomes.
 */
@Service
public class PendingDeletionLifecycle {
    
    private static final Logger log = LoggerFactory.getLogger(PendingDeletionLifecycle.class);
    
    public static final String SYSTEM_ACTOR = "system";
    
    private final PendingDeletionRepository repository;
    private final DeletionProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    
    public PendingDeletionLifecycle(PendingDeletionRepository repository,
                                    DeletionProperties properties,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }
    
    @Transactional
    public PendingDeletion approve(Long id, String actor, Instant scheduledDate, String reason) {
        return doApprove(id, actor, scheduledDate, reason);
    }
    
    @Transactional
    public PendingDeletion cancel(Long id, String actor, String reason) {
        return doCancel(id, actor, reason);
    }
    
    @Transactional
    public PendingDeletion resubmit(Long id, String actor) {
        PendingDeletion item = load(id);
        item.resubmit(resolveActor(actor), Instant.now(clock));
        PendingDeletion saved = repository.save(item);
        log.info("Resubmitted pending deletion: id={}, actor={}", id, saved.getResubmittedBy());
        return saved;
    }
    
    public List<BulkItemOutcome> bulkApprove(List<Long> ids, String actor, Instant scheduledDate, String reason) {
        return bulk(ids, id -> doApprove(id, actor, scheduledDate, reason));
    }
    
    public List<BulkItemOutcome> bulkCancel(List<Long> ids, String actor, String reason) {
        return bulk(ids, id -> doCancel(id, actor, reason));
    }
    
    private PendingDeletion doApprove(Long id, String actor, Instant scheduledDate, String reason) {
        PendingDeletion item = load(id);
        item.approve(resolveActor(actor), scheduledDate, reason, Instant.now(clock));
        PendingDeletion saved = repository.save(item);
        log.info("Approved pending deletion: id={}, actor={}, scheduledDate={}",
            id, saved.getApprovedBy(), saved.getScheduledDate());
        return saved;
    }
    
    private PendingDeletion doCancel(Long id, String actor, String reason) {
        PendingDeletion item = load(id);
        item.cancel(resolveActor(actor), reason, Instant.now(clock), properties.getExecution().getLeaseTimeout());
        PendingDeletion saved = repository.save(item);
        log.info("Cancelled pending deletion: id={}, actor={}", id, saved.getCancelledBy());
        return saved;
    }
    
    private List<BulkItemOutcome> bulk(List<Long> ids, Function<Long, PendingDeletion> transition) {
        List<BulkItemOutcome> outcomes = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(ids)) {
            if (id == null) {
                outcomes.add(BulkItemOutcome.notFound(null, "Pending deletion id is required"));
                continue;
            }
            try {
                PendingDeletion updated = transactionTemplate.execute(status -> transition.apply(id));
                outcomes.add(BulkItemOutcome.applied(id, updated.getStatus()));
            } catch (NotFoundException e) {
                outcomes.add(BulkItemOutcome.notFound(id, e.getMessage()));
            } catch (ConflictException e) {
                outcomes.add(BulkItemOutcome.conflict(id, e.getMessage()));
            } catch (OptimisticLockingFailureException e) {
                log.warn("Concurrent modification during bulk transition: id={}", id);
                outcomes.add(BulkItemOutcome.conflict(id, "Modified concurrently"));
            } catch (RuntimeException e) {
                log.error("Bulk transition failed: id={}", id, e);
                outcomes.add(BulkItemOutcome.error(id, e.getMessage()));
            }
        }
        return outcomes;
    }
    
    private PendingDeletion load(Long id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("Pending deletion not found: " + id));
    }
    
    public static String resolveActor(String actor) {
        return actor == null || actor.isBlank() ? SYSTEM_ACTOR : actor.trim();
    }
}
