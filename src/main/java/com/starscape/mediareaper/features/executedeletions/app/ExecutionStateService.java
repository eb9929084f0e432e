package com.starscape.mediareaper.features.executedeletions.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.common.outbox.OutboxService;
import com.starscape.mediareaper.features.pendingdeletions.domain.ExecutionResult;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Short transactions around the persistent side of an execution pass. No integration call
 * ever runs inside one of these transactions.
 */
@Service
public class ExecutionStateService {
    
    private static final Logger log = LoggerFactory.getLogger(ExecutionStateService.class);
    private static final String AGGREGATE_TYPE = "PendingDeletion";
    
    private final PendingDeletionRepository pendingDeletionRepository;
    private final OutboxService outboxService;
    private final DeletionProperties.Execution settings;
    
    public ExecutionStateService(
            PendingDeletionRepository pendingDeletionRepository,
            OutboxService outboxService,
            DeletionProperties deletionProperties) {
        this.pendingDeletionRepository = pendingDeletionRepository;
        this.outboxService = outboxService;
        this.settings = deletionProperties.getExecution();
    }
    
    @Transactional(readOnly = true)
    public List<Long> findEligibleIds(Instant now) {
        return pendingDeletionRepository.findExecutableIds(
            now,
            now.minus(settings.getLeaseTimeout()),
            settings.isRetryFailed(),
            settings.getMaxAttempts());
    }
    
    /**
     * Take the execution lease on an item. Empty when the item is gone or no longer executable,
     * e.g. it was cancelled after selection. A concurrent claim surfaces as an optimistic lock failure.
     */
    @Transactional
    public Optional<PendingDeletion> claim(Long id, Instant now) {
        Optional<PendingDeletion> found = pendingDeletionRepository.findById(id);
        if (found.isEmpty()) {
            log.info("Pending deletion disappeared before execution: id={}", id);
            return Optional.empty();
        }
        PendingDeletion pendingDeletion = found.get();
        if (!pendingDeletion.isExecutable(now, settings.getLeaseTimeout(),
                settings.isRetryFailed(), settings.getMaxAttempts())) {
            log.info("Pending deletion no longer executable: id={}, status={}", id, pendingDeletion.getStatus());
            return Optional.empty();
        }
        pendingDeletion.claim(now);
        return Optional.of(pendingDeletionRepository.save(pendingDeletion));
    }
    
    @Transactional
    public PendingDeletion complete(Long id, ExecutionResult result) {
        PendingDeletion pendingDeletion = load(id);
        pendingDeletion.recordSuccess(result);
        PendingDeletion saved = pendingDeletionRepository.save(pendingDeletion);
        outboxService.publishAll(pendingDeletion, AGGREGATE_TYPE);
        return saved;
    }
    
    @Transactional
    public PendingDeletion fail(Long id, ExecutionResult result) {
        PendingDeletion pendingDeletion = load(id);
        pendingDeletion.recordFailure(result);
        PendingDeletion saved = pendingDeletionRepository.save(pendingDeletion);
        outboxService.publishAll(pendingDeletion, AGGREGATE_TYPE);
        return saved;
    }
    
    private PendingDeletion load(Long id) {
        return pendingDeletionRepository.findById(id)
            .orElseThrow(() -> new IllegalStateException("Claimed pending deletion vanished: " + id));
    }
}
