package com.starscape.mediareaper.features.history.app;

import com.starscape.mediareaper.features.history.domain.DeletedMediaSummary;
import com.starscape.mediareaper.features.history.domain.DeletionHistory;
import com.starscape.mediareaper.features.history.domain.DeletionHistoryRepository;
import com.starscape.mediareaper.features.history.domain.ExecutionTrigger;
import com.starscape.mediareaper.features.media.domain.MediaType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HistoryQueriesTest {
    
    private static DeletedMediaSummary item(long id, Long ruleId, boolean success, long bytes) {
        return new DeletedMediaSummary(id, id, ruleId, "Rule " + ruleId, "Title", "f.mkv", "/f.mkv",
            MediaType.MOVIE, bytes, success, success ? bytes : 0L, success ? null : "failed");
    }
    
    @Test
    void aggregatesPerRuleAcrossPasses() {
        DeletionHistoryRepository repository = mock(DeletionHistoryRepository.class);
        Instant first = Instant.parse("2024-06-01T10:00:00Z");
        Instant second = Instant.parse("2024-06-02T10:00:00Z");
        when(repository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(
            new DeletionHistory(List.of(item(1, 5L, true, 100), item(2, 5L, false, 50), item(3, 6L, true, 10)),
                ExecutionTrigger.MANUAL, first),
            new DeletionHistory(List.of(item(4, 5L, true, 200), item(5, null, true, 999)),
                ExecutionTrigger.SCHEDULED, second)));
        HistoryQueries queries = new HistoryQueries(repository);
        
        RuleStats rule5 = queries.ruleStats(5L);
        
        assertEquals(2, rule5.executions());
        assertEquals(2, rule5.itemsDeleted());
        assertEquals(1, rule5.itemsFailed());
        assertEquals(300L, rule5.bytesFreed());
        assertEquals(second, rule5.lastExecutedAt());
        assertEquals(2, queries.allRuleStats().size());
    }
    
    @Test
    void ruleThatNeverRanHasZeroStats() {
        DeletionHistoryRepository repository = mock(DeletionHistoryRepository.class);
        when(repository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of());
        
        RuleStats stats = new HistoryQueries(repository).ruleStats(42L);
        
        assertEquals(42L, stats.ruleId());
        assertEquals(0, stats.executions());
        assertNull(stats.lastExecutedAt());
    }
}
