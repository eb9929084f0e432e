package com.starscape.mediareaper.features.executedeletions.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.features.executedeletions.domain.DeletionIntegration;
import com.starscape.mediareaper.features.executedeletions.domain.ExecutionSummary;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationException;
import com.starscape.mediareaper.features.executedeletions.domain.IntegrationOutcome;
import com.starscape.mediareaper.features.executedeletions.domain.ItemOutcome;
import com.starscape.mediareaper.features.executedeletions.infra.IntegrationResolver;
import com.starscape.mediareaper.features.history.app.HistoryRecorder;
import com.starscape.mediareaper.features.history.domain.DeletedMediaSummary;
import com.starscape.mediareaper.features.history.domain.DeletionHistory;
import com.starscape.mediareaper.features.history.domain.ExecutionTrigger;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.pendingdeletions.domain.ExecutionResult;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import com.starscape.mediareaper.features.rules.domain.DeletionStrategy;
import com.starscape.mediareaper.features.rules.domain.RuleSnapshot;
import com.starscape.mediareaper.features.trackprogress.app.ProgressBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executes every eligible pending deletion against the integration that owns it.
 * <p>
 * One pass at a time per process: a second caller gets a BUSY summary instead of waiting.
 * Items are processed on a fixed worker pool; each integration call runs on its own pool
 * and is abandoned after the configured item timeout. One item's failure never aborts the pass.
 */
@Service
public class ExecutionEngine {
    
    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);
    
    private final ReentrantLock passLock = new ReentrantLock();
    private final AtomicReference<ExecutionSummary> lastSummary = new AtomicReference<>();
    
    private final ExecutionStateService stateService;
    private final IntegrationResolver integrationResolver;
    private final HistoryRecorder historyRecorder;
    private final ProgressBroadcaster progressBroadcaster;
    private final ThreadPoolTaskExecutor workerExecutor;
    private final ThreadPoolTaskExecutor integrationExecutor;
    private final Duration itemTimeout;
    private final Clock clock;
    
    public ExecutionEngine(
            ExecutionStateService stateService,
            IntegrationResolver integrationResolver,
            HistoryRecorder historyRecorder,
            ProgressBroadcaster progressBroadcaster,
            @Qualifier("deletionWorkerExecutor") ThreadPoolTaskExecutor workerExecutor,
            @Qualifier("integrationCallExecutor") ThreadPoolTaskExecutor integrationExecutor,
            DeletionProperties deletionProperties,
            Clock clock) {
        this.stateService = stateService;
        this.integrationResolver = integrationResolver;
        this.historyRecorder = historyRecorder;
        this.progressBroadcaster = progressBroadcaster;
        this.workerExecutor = workerExecutor;
        this.integrationExecutor = integrationExecutor;
        this.itemTimeout = deletionProperties.getExecution().getItemTimeout();
        this.clock = clock;
    }
    
    /**
     * Run one execution pass now. Shared by the manual trigger and the scheduler.
     */
    public ExecutionSummary executeNow(ExecutionTrigger trigger) {
        Instant startedAt = clock.instant();
        if (!passLock.tryLock()) {
            log.info("Execution pass already running, rejecting trigger={}", trigger);
            return ExecutionSummary.busy(trigger, startedAt);
        }
        try {
            ExecutionSummary summary = runPass(trigger, startedAt);
            lastSummary.set(summary);
            return summary;
        } finally {
            passLock.unlock();
        }
    }
    
    public boolean isRunning() {
        return passLock.isLocked();
    }
    
    public Optional<ExecutionSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }
    
    private ExecutionSummary runPass(ExecutionTrigger trigger, Instant startedAt) {
        List<Long> eligible = stateService.findEligibleIds(startedAt);
        log.info("Starting execution pass: trigger={}, eligible={}", trigger, eligible.size());
        progressBroadcaster.executionStarted(eligible.size());
        
        List<Future<ItemOutcome>> futures = new ArrayList<>(eligible.size());
        for (Long id : eligible) {
            futures.add(workerExecutor.submit(() -> executeItem(id)));
        }
        
        List<ItemOutcome> outcomes = new ArrayList<>(eligible.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(eligible.get(i), futures.get(i)));
        }
        
        Instant finishedAt = clock.instant();
        List<DeletedMediaSummary> attempted = outcomes.stream()
                .filter(ItemOutcome::attempted)
                .map(ItemOutcome::toSummary)
                .toList();
        DeletionHistory history = historyRecorder.record(attempted, trigger, finishedAt);
        
        ExecutionSummary summary = ExecutionSummary.of(trigger, outcomes, startedAt, finishedAt, history.getId());
        progressBroadcaster.executionCompleted(summary.totalItems(), summary.successful(),
            summary.failed(), summary.bytesFreed());
        log.info("Execution pass finished: trigger={}, outcome={}, successful={}, failed={}, skipped={}, bytesFreed={}",
            trigger, summary.outcome(), summary.successful(), summary.failed(), summary.skipped(), summary.bytesFreed());
        return summary;
    }
    
    private ItemOutcome await(Long id, Future<ItemOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for pending deletion {}", id);
            return ItemOutcome.skipped(id, "Execution interrupted");
        } catch (ExecutionException e) {
            // State was not written; the lease expires and a later pass picks the item up again.
            log.error("Unexpected error executing pending deletion {}", id, e.getCause());
            return ItemOutcome.skipped(id, "Execution error: " + e.getCause().getMessage());
        }
    }
    
    private ItemOutcome executeItem(Long id) {
        Optional<PendingDeletion> claimed;
        try {
            claimed = stateService.claim(id, clock.instant());
        } catch (OptimisticLockingFailureException e) {
            log.info("Pending deletion changed concurrently, skipping: id={}", id);
            return ItemOutcome.skipped(id, "Modified concurrently");
        }
        if (claimed.isEmpty()) {
            return ItemOutcome.skipped(id, "No longer eligible for execution");
        }
        
        PendingDeletion item = claimed.get();
        MediaSnapshot media = item.getMediaSnapshot();
        RuleSnapshot rule = item.getRuleSnapshot();
        DeletionStrategy strategy = rule.deletionStrategy() != null ? rule.deletionStrategy() : DeletionStrategy.defaults();
        DeletionIntegration integration = integrationResolver.resolve(media.type());
        
        try {
            IntegrationOutcome outcome = invoke(integration, media, strategy);
            ExecutionResult result = ExecutionResult.succeeded(clock.instant(), integration.kind(),
                outcome.actions(), outcome.bytesFreed());
            PendingDeletion recorded = stateService.complete(id, result);
            progressBroadcaster.itemCompleted(id, media.displayTitle(), outcome.bytesFreed());
            log.info("Deleted media: pendingDeletionId={}, mediaId={}, integration={}, bytesFreed={}",
                id, media.id(), integration.kind(), outcome.bytesFreed());
            return toOutcome(recorded, ItemOutcome.Status.COMPLETED, result);
        } catch (IntegrationException e) {
            ExecutionResult result = ExecutionResult.failed(clock.instant(), integration.kind(), e.getMessage());
            PendingDeletion recorded = stateService.fail(id, result);
            progressBroadcaster.itemFailed(id, media.displayTitle(), e.getMessage());
            log.warn("Deletion failed: pendingDeletionId={}, mediaId={}, integration={}, error={}",
                id, media.id(), integration.kind(), e.getMessage());
            return toOutcome(recorded, ItemOutcome.Status.FAILED, result);
        }
    }
    
    private IntegrationOutcome invoke(DeletionIntegration integration, MediaSnapshot media, DeletionStrategy strategy)
            throws IntegrationException {
        Future<IntegrationOutcome> call = integrationExecutor.submit(() -> integration.delete(media, strategy));
        try {
            return call.get(itemTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new IntegrationException(integration.kind() + " call timed out after " + itemTimeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new IntegrationException("Interrupted while waiting for " + integration.kind(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IntegrationException) {
                throw (IntegrationException) cause;
            }
            throw new IntegrationException("Unexpected " + integration.kind() + " error: " + cause.getMessage(), cause);
        }
    }
    
    private ItemOutcome toOutcome(PendingDeletion item, ItemOutcome.Status status, ExecutionResult result) {
        MediaSnapshot media = item.getMediaSnapshot();
        return new ItemOutcome(
            item.getId(),
            media.id(),
            item.getRuleId(),
            item.getRuleSnapshot().name(),
            media.displayTitle(),
            media.filename(),
            media.path(),
            media.type(),
            media.size(),
            status,
            result.integration(),
            result.actions(),
            result.bytesFreed(),
            result.error());
    }
}
