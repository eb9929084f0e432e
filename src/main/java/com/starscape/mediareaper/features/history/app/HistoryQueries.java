package com.starscape.mediareaper.features.history.app;

import com.starscape.mediareaper.features.history.domain.DeletedMediaSummary;
import com.starscape.mediareaper.features.history.domain.DeletionHistory;
import com.starscape.mediareaper.features.history.domain.DeletionHistoryRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * History listing and per-rule statistics. Statistics are folded from the per-item
 * summaries, so passes that touched several rules count for each of them.
 */
@Service
public class HistoryQueries {
    
    private static final int MAX_PAGE_SIZE = 200;
    
    private final DeletionHistoryRepository historyRepository;
    
    public HistoryQueries(DeletionHistoryRepository historyRepository) {
        this.historyRepository = historyRepository;
    }
    
    @Transactional(readOnly = true)
    public Page<DeletionHistory> list(int page, int size) {
        return historyRepository.findAllByOrderByCreatedAtDescIdDesc(
            PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE)));
    }
    
    /**
     * Totals for one rule; zeros when it never executed.
     */
    @Transactional(readOnly = true)
    public RuleStats ruleStats(Long ruleId) {
        RuleStats stats = aggregate().get(ruleId);
        return stats != null ? stats : new RuleStats(ruleId, null, 0, 0, 0, 0, null);
    }
    
    @Transactional(readOnly = true)
    public List<RuleStats> allRuleStats() {
        return new ArrayList<>(aggregate().values());
    }
    
    private Map<Long, RuleStats> aggregate() {
        Map<Long, Accumulator> byRule = new LinkedHashMap<>();
        for (DeletionHistory history : historyRepository.findAllByOrderByCreatedAtAsc()) {
            Map<Long, Boolean> seenInPass = new LinkedHashMap<>();
            for (DeletedMediaSummary item : history.getMediaDeleted()) {
                if (item.ruleId() == null) {
                    continue;
                }
                Accumulator acc = byRule.computeIfAbsent(item.ruleId(), id -> new Accumulator());
                acc.ruleName = item.ruleName();
                if (item.success()) {
                    acc.deleted++;
                    acc.bytesFreed += item.bytesFreed();
                } else {
                    acc.failed++;
                }
                if (seenInPass.putIfAbsent(item.ruleId(), Boolean.TRUE) == null) {
                    acc.executions++;
                    acc.lastExecutedAt = history.getCreatedAt();
                }
            }
        }
        Map<Long, RuleStats> result = new LinkedHashMap<>();
        byRule.forEach((ruleId, acc) -> result.put(ruleId, new RuleStats(ruleId, acc.ruleName,
            acc.executions, acc.deleted, acc.failed, acc.bytesFreed, acc.lastExecutedAt)));
        return result;
    }
    
    private static final class Accumulator {
        private String ruleName;
        private long executions;
        private long deleted;
        private long failed;
        private long bytesFreed;
        private Instant lastExecutedAt;
    }
}
