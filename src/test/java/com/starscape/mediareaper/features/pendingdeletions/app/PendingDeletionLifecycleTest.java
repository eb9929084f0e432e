package com.starscape.mediareaper.features.pendingdeletions.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.common.exception.NotFoundException;
import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.pendingdeletions.domain.ExecutionResult;
import com.starscape.mediareaper.features.pendingdeletions.domain.IntegrationKind;
import com.starscape.mediareaper.features.pendingdeletions.domain.InvalidTransitionException;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionRepository;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.starscape.mediareaper.TestFixtures.NOW;
import static com.starscape.mediareaper.TestFixtures.movie;
import static com.starscape.mediareaper.TestFixtures.rule;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PendingDeletionLifecycleTest {
    
    private PendingDeletionRepository repository;
    private PendingDeletionLifecycle lifecycle;
    
    @BeforeEach
    void setUp() {
        repository = mock(PendingDeletionRepository.class);
        when(repository.save(any(PendingDeletion.class))).thenAnswer(invocation -> invocation.getArgument(0));
        lifecycle = new PendingDeletionLifecycle(repository, new DeletionProperties(),
            mock(PlatformTransactionManager.class), Clock.fixed(NOW, ZoneOffset.UTC));
    }
    
    private PendingDeletion stored(long id) {
        PendingDeletion item = new PendingDeletion(movie(id).build(), rule(1L, Set.of(MediaType.MOVIE), List.of()), NOW);
        when(repository.findById(id)).thenReturn(Optional.of(item));
        return item;
    }
    
    @Test
    void approveWithBlankActorUsesSystem() {
        stored(1L);
        
        PendingDeletion approved = lifecycle.approve(1L, "  ", null, null);
        
        assertEquals(PendingDeletionStatus.APPROVED, approved.getStatus());
        assertEquals(PendingDeletionLifecycle.SYSTEM_ACTOR, approved.getApprovedBy());
        assertEquals(NOW, approved.getScheduledDate());
    }
    
    @Test
    void approveUnknownIdIsNotFound() {
        when(repository.findById(99L)).thenReturn(Optional.empty());
        
        assertThrows(NotFoundException.class, () -> lifecycle.approve(99L, "alice", null, null));
        verify(repository, never()).save(any());
    }
    
    @Test
    void illegalTransitionLeavesStatusUnchanged() {
        PendingDeletion item = stored(1L);
        lifecycle.cancel(1L, "alice", null);
        
        assertThrows(InvalidTransitionException.class, () -> lifecycle.approve(1L, "bob", null, null));
        assertEquals(PendingDeletionStatus.CANCELLED, item.getStatus());
    }
    
    @Test
    void bulkApproveReportsEachItemIndependently() {
        stored(1L);
        PendingDeletion alreadyCancelled = stored(2L);
        alreadyCancelled.cancel("alice", null, NOW, new DeletionProperties().getExecution().getLeaseTimeout());
        stored(3L);
        when(repository.findById(4L)).thenReturn(Optional.empty());
        
        List<BulkItemOutcome> outcomes = lifecycle.bulkApprove(List.of(1L, 2L, 3L, 4L, 1L), "bob", null, "cleanup");
        
        assertEquals(4, outcomes.size());
        assertEquals(BulkItemOutcome.Outcome.APPLIED, outcomes.get(0).outcome());
        assertEquals(PendingDeletionStatus.APPROVED, outcomes.get(0).status());
        assertEquals(BulkItemOutcome.Outcome.CONFLICT, outcomes.get(1).outcome());
        assertEquals(BulkItemOutcome.Outcome.APPLIED, outcomes.get(2).outcome());
        assertEquals(BulkItemOutcome.Outcome.NOT_FOUND, outcomes.get(3).outcome());
    }
    
    @Test
    void concurrentModificationInBulkCancelIsAConflictForThatItemOnly() {
        PendingDeletion first = stored(1L);
        PendingDeletion second = stored(2L);
        when(repository.save(first)).thenThrow(new ObjectOptimisticLockingFailureException(PendingDeletion.class, 1L));
        
        List<BulkItemOutcome> outcomes = lifecycle.bulkCancel(List.of(1L, 2L), "alice", "not needed");
        
        assertEquals(BulkItemOutcome.Outcome.CONFLICT, outcomes.get(0).outcome());
        assertEquals(BulkItemOutcome.Outcome.APPLIED, outcomes.get(1).outcome());
        assertEquals(PendingDeletionStatus.CANCELLED, second.getStatus());
    }
    
    @Test
    void optimisticLockFailureOnSingleApprovePropagates() {
        PendingDeletion item = stored(1L);
        when(repository.save(item)).thenThrow(new ObjectOptimisticLockingFailureException(PendingDeletion.class, 1L));
        
        assertThrows(OptimisticLockingFailureException.class, () -> lifecycle.approve(1L, "alice", null, null));
    }
    
    @Test
    void databaseFailureOnOneBulkItemDoesNotStopTheOthers() {
        stored(1L);
        when(repository.findById(2L)).thenThrow(new DataAccessResourceFailureException("connection reset"));
        PendingDeletion third = stored(3L);
        
        List<BulkItemOutcome> outcomes = lifecycle.bulkCancel(List.of(1L, 2L, 3L), "alice", null);
        
        assertEquals(3, outcomes.size());
        assertEquals(BulkItemOutcome.Outcome.APPLIED, outcomes.get(0).outcome());
        assertEquals(BulkItemOutcome.Outcome.ERROR, outcomes.get(1).outcome());
        assertEquals(2L, outcomes.get(1).id());
        assertEquals("connection reset", outcomes.get(1).message());
        assertEquals(BulkItemOutcome.Outcome.APPLIED, outcomes.get(2).outcome());
        assertEquals(PendingDeletionStatus.CANCELLED, third.getStatus());
    }
    
    @Test
    void nullIdInBulkRequestIsReportedNotFound() {
        stored(1L);
        stored(3L);
        
        List<BulkItemOutcome> outcomes = lifecycle.bulkApprove(Arrays.asList(1L, null, 3L), "bob", null, null);
        
        assertEquals(3, outcomes.size());
        assertEquals(BulkItemOutcome.Outcome.NOT_FOUND, outcomes.get(1).outcome());
        assertNull(outcomes.get(1).id());
        assertEquals(BulkItemOutcome.Outcome.APPLIED, outcomes.get(2).outcome());
        verify(repository, never()).findById(null);
    }
    
    @Test
    void resubmitRecordsActorAndTime() {
        PendingDeletion item = stored(1L);
        item.approve("alice", null, null, NOW);
        item.claim(NOW);
        item.recordFailure(ExecutionResult.failed(NOW, IntegrationKind.RADARR, "Radarr deletion failed: 503"));
        
        PendingDeletion resubmitted = lifecycle.resubmit(1L, " ");
        
        assertEquals(PendingDeletionStatus.FAILED, resubmitted.getStatus());
        assertTrue(resubmitted.isRetryRequested());
        assertEquals(PendingDeletionLifecycle.SYSTEM_ACTOR, resubmitted.getResubmittedBy());
        assertEquals(NOW, resubmitted.getResubmittedAt());
    }
}
