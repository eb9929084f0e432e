package com.starscape.mediareaper.features.pendingdeletions.api;

import com.starscape.mediareaper.features.pendingdeletions.api.dto.PendingDeletionListResponse;
import com.starscape.mediareaper.features.pendingdeletions.api.dto.PendingDeletionResponse;
import com.starscape.mediareaper.features.pendingdeletions.api.dto.PendingDeletionSummaryResponse;
import com.starscape.mediareaper.features.pendingdeletions.app.PendingDeletionQueries;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/queries/pending-deletions")
public class PendingDeletionQueryController {
    
    private final PendingDeletionQueries queries;
    
    public PendingDeletionQueryController(PendingDeletionQueries queries) {
        this.queries = queries;
    }
    
    /**
     * GET /queries/pending-deletions?status=APPROVED&ruleId=1&page=0&size=20
     */
    @GetMapping
    public ResponseEntity<PendingDeletionListResponse> list(
            @RequestParam(required = false) PendingDeletionStatus status,
            @RequestParam(required = false) Long ruleId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(PendingDeletionListResponse.from(queries.list(status, ruleId, page, size)));
    }
    
    /**
     * GET /queries/pending-deletions/summary
     */
    @GetMapping("/summary")
    public ResponseEntity<PendingDeletionSummaryResponse> summary() {
        return ResponseEntity.ok(PendingDeletionSummaryResponse.from(queries.summary()));
    }
    
    @GetMapping("/{id}")
    public ResponseEntity<PendingDeletionResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(PendingDeletionResponse.from(queries.get(id)));
    }
}
