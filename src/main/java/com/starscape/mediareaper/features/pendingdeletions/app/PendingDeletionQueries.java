package com.starscape.mediareaper.features.pendingdeletions.app;

import com.starscape.mediareaper.common.exception.NotFoundException;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionRepository;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus;
import com.starscape.mediareaper.features.pendingdeletions.domain.StatusTotals;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class PendingDeletionQueries {
    
    private static final int MAX_PAGE_SIZE = 200;
    
    private final PendingDeletionRepository repository;
    
    public PendingDeletionQueries(PendingDeletionRepository repository) {
        this.repository = repository;
    }
    
    @Transactional(readOnly = true)
    public Page<PendingDeletion> list(PendingDeletionStatus status, Long ruleId, int page, int size) {
        Pageable pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
            Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "id")));
        if (status != null && ruleId != null) {
            return repository.findByStatusAndRuleId(status, ruleId, pageable);
        }
        if (status != null) {
            return repository.findByStatus(status, pageable);
        }
        if (ruleId != null) {
            return repository.findByRuleId(ruleId, pageable);
        }
        return repository.findAll(pageable);
    }
    
    @Transactional(readOnly = true)
    public PendingDeletion get(Long id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("Pending deletion not found: " + id));
    }
    
    /**
     * Count and total size per status; statuses without items report zero.
     */
    @Transactional(readOnly = true)
    public Map<PendingDeletionStatus, StatusTotals> summary() {
        Map<PendingDeletionStatus, StatusTotals> totals = new EnumMap<>(PendingDeletionStatus.class);
        for (PendingDeletionStatus status : PendingDeletionStatus.values()) {
            totals.put(status, new StatusTotals(status, 0L, 0L));
        }
        List<StatusTotals> rows = repository.summarizeByStatus();
        rows.forEach(row -> totals.put(row.status(), row));
        return totals;
    }
}
