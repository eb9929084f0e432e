package com.starscape.mediareaper.features.history.app;

import com.starscape.mediareaper.common.outbox.OutboxService;
import com.starscape.mediareaper.features.history.domain.DeletedMediaSummary;
import com.starscape.mediareaper.features.history.domain.DeletionHistory;
import com.starscape.mediareaper.features.history.domain.DeletionHistoryRepository;
import com.starscape.mediareaper.features.history.domain.ExecutionTrigger;
import com.starscape.mediareaper.features.history.domain.events.DeletionBatchCompleted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Service
public class HistoryRecorder {
    
    private static final Logger log = LoggerFactory.getLogger(HistoryRecorder.class);
    
    private final DeletionHistoryRepository historyRepository;
    private final OutboxService outboxService;
    
    public HistoryRecorder(DeletionHistoryRepository historyRepository, OutboxService outboxService) {
        this.historyRepository = historyRepository;
        this.outboxService = outboxService;
    }
    
    /**
     * Append the record of one execution pass. An empty pass is recorded too.
     */
    @Transactional
    public DeletionHistory record(List<DeletedMediaSummary> items, ExecutionTrigger trigger, Instant finishedAt) {
        DeletionHistory saved = historyRepository.save(new DeletionHistory(items, trigger, finishedAt));
        if (saved.getItemsAttempted() > 0) {
            outboxService.publish(new DeletionBatchCompleted(saved.getId(), trigger, saved.getItemsAttempted(),
                saved.getItemsSucceeded(), saved.getTotalSizeFreed(), saved.getError(), finishedAt),
                "DeletionHistory");
        }
        log.info("Recorded deletion history: historyId={}, trigger={}, attempted={}, succeeded={}, bytesFreed={}",
            saved.getId(), trigger, saved.getItemsAttempted(), saved.getItemsSucceeded(), saved.getTotalSizeFreed());
        return saved;
    }
}
