package com.starscape.mediareaper.features.executedeletions.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.common.exception.ValidationException;
import com.starscape.mediareaper.features.executedeletions.domain.ExecutionOutcome;
import com.starscape.mediareaper.features.executedeletions.domain.ExecutionSummary;
import com.starscape.mediareaper.features.history.domain.ExecutionTrigger;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Recurring timer that triggers execution passes. Owns its own armed/disarmed state;
 * the tick goes through {@link ExecutionEngine#executeNow}, the same entry point as a manual run.
 */
@Component
public class ExecutionScheduler {
    
    private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);
    
    private final TaskScheduler taskScheduler;
    private final ExecutionEngine executionEngine;
    private final DeletionProperties.Scheduler settings;
    private final Clock clock;
    
    private ScheduledFuture<?> timer;
    private Integer intervalMinutes;
    private Instant armedAt;
    private volatile Instant lastRunAt;
    private volatile String lastError;
    
    public ExecutionScheduler(
            @Qualifier("taskScheduler") TaskScheduler taskScheduler,
            ExecutionEngine executionEngine,
            DeletionProperties deletionProperties,
            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.executionEngine = executionEngine;
        this.settings = deletionProperties.getScheduler();
        this.clock = clock;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (settings.isEnabled()) {
            try {
                start(settings.getIntervalMinutes());
            } catch (ValidationException e) {
                lastError = e.getMessage();
                log.error("Execution scheduler not started: {}", e.getMessage());
            }
        }
    }
    
    /**
     * Arm the timer; the first pass runs immediately. Re-arming with the same interval is a no-op,
     * a different interval replaces the running timer.
     */
    public synchronized ExecutionStatus start(int intervalMinutes) {
        if (intervalMinutes < settings.getMinIntervalMinutes()) {
            throw new ValidationException("Interval is below the minimum",
                Map.of("intervalMinutes", "must be at least " + settings.getMinIntervalMinutes()));
        }
        if (timer != null && this.intervalMinutes == intervalMinutes) {
            log.info("Execution scheduler already running: intervalMinutes={}", intervalMinutes);
            return status();
        }
        cancelTimer();
        
        Instant now = clock.instant();
        this.timer = taskScheduler.scheduleAtFixedRate(this::tick, now, Duration.ofMinutes(intervalMinutes));
        this.intervalMinutes = intervalMinutes;
        this.armedAt = now;
        this.lastError = null;
        log.info("Execution scheduler started: intervalMinutes={}", intervalMinutes);
        return status();
    }
    
    @PreDestroy
    public synchronized ExecutionStatus stop() {
        if (timer != null) {
            cancelTimer();
            log.info("Execution scheduler stopped");
        }
        return status();
    }
    
    public synchronized ExecutionStatus status() {
        return new ExecutionStatus(
            executionEngine.isRunning(),
            timer != null,
            intervalMinutes,
            lastRunAt,
            nextRunAt(),
            lastError,
            executionEngine.getLastSummary().orElse(null));
    }
    
    void tick() {
        lastRunAt = clock.instant();
        try {
            ExecutionSummary summary = executionEngine.executeNow(ExecutionTrigger.SCHEDULED);
            if (summary.outcome() == ExecutionOutcome.BUSY) {
                log.info("Scheduled execution skipped, a pass is already running");
            }
            lastError = null;
        } catch (RuntimeException e) {
            lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Scheduled execution failed", e);
        }
    }
    
    private Instant nextRunAt() {
        if (timer == null) {
            return null;
        }
        Duration interval = Duration.ofMinutes(intervalMinutes);
        Instant last = lastRunAt;
        return last != null && !last.isBefore(armedAt) ? last.plus(interval) : armedAt;
    }
    
    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
        }
        timer = null;
        intervalMinutes = null;
        armedAt = null;
    }
}
