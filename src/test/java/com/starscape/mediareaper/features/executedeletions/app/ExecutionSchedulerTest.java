package com.starscape.mediareaper.features.executedeletions.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.common.exception.ValidationException;
import com.starscape.mediareaper.features.executedeletions.domain.ExecutionSummary;
import com.starscape.mediareaper.features.history.domain.ExecutionTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static com.starscape.mediareaper.TestFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExecutionSchedulerTest {
    
    private TaskScheduler taskScheduler;
    private ExecutionEngine engine;
    private ScheduledFuture<?> firstTimer;
    private ScheduledFuture<?> secondTimer;
    private ExecutionScheduler scheduler;
    
    @BeforeEach
    void setUp() {
        taskScheduler = mock(TaskScheduler.class);
        engine = mock(ExecutionEngine.class);
        when(engine.getLastSummary()).thenReturn(Optional.empty());
        firstTimer = mock(ScheduledFuture.class);
        secondTimer = mock(ScheduledFuture.class);
        doReturn(firstTimer, secondTimer).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        
        DeletionProperties properties = new DeletionProperties();
        properties.getScheduler().setMinIntervalMinutes(5);
        scheduler = new ExecutionScheduler(taskScheduler, engine, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }
    
    @Test
    void intervalBelowMinimumIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class, () -> scheduler.start(4));
        
        assertTrue(ex.getDetails().containsKey("intervalMinutes"));
        assertFalse(scheduler.status().scheduled());
        verifyNoInteractions(taskScheduler);
    }
    
    @Test
    void startArmsTimerWithImmediateFirstRun() {
        ExecutionStatus status = scheduler.start(30);
        
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(NOW), eq(Duration.ofMinutes(30)));
        assertTrue(status.scheduled());
        assertEquals(30, status.intervalMinutes());
        assertEquals(NOW, status.nextRunAt());
        assertNull(status.lastRunAt());
    }
    
    @Test
    void restartWithSameIntervalKeepsExistingTimer() {
        scheduler.start(30);
        scheduler.start(30);
        
        verify(taskScheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        verify(firstTimer, never()).cancel(anyBoolean());
    }
    
    @Test
    void restartWithDifferentIntervalReplacesTimer() {
        scheduler.start(30);
        ExecutionStatus status = scheduler.start(60);
        
        verify(firstTimer).cancel(false);
        assertEquals(60, status.intervalMinutes());
        assertTrue(status.scheduled());
    }
    
    @Test
    void stopDisarmsTimer() {
        scheduler.start(30);
        
        ExecutionStatus status = scheduler.stop();
        
        verify(firstTimer).cancel(false);
        assertFalse(status.scheduled());
        assertNull(status.intervalMinutes());
        assertNull(status.nextRunAt());
    }
    
    @Test
    void tickRunsScheduledPassAndAdvancesNextRun() {
        when(engine.executeNow(ExecutionTrigger.SCHEDULED))
                .thenReturn(ExecutionSummary.busy(ExecutionTrigger.SCHEDULED, NOW));
        scheduler.start(30);
        
        scheduler.tick();
        
        verify(engine).executeNow(ExecutionTrigger.SCHEDULED);
        ExecutionStatus status = scheduler.status();
        assertEquals(NOW, status.lastRunAt());
        assertEquals(NOW.plus(Duration.ofMinutes(30)), status.nextRunAt());
        assertNull(status.lastError());
    }
    
    @Test
    void tickFailureIsKeptAsLastError() {
        when(engine.executeNow(ExecutionTrigger.SCHEDULED)).thenThrow(new IllegalStateException("database unavailable"));
        scheduler.start(30);
        
        scheduler.tick();
        
        assertEquals("database unavailable", scheduler.status().lastError());
        assertTrue(scheduler.status().scheduled());
    }
}
