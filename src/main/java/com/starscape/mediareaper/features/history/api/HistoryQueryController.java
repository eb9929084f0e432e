package com.starscape.mediareaper.features.history.api;

import com.starscape.mediareaper.features.history.api.dto.DeletionHistoryPageResponse;
import com.starscape.mediareaper.features.history.app.HistoryQueries;
import com.starscape.mediareaper.features.history.app.RuleStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/queries")
public class HistoryQueryController {
    
    private final HistoryQueries historyQueries;
    
    public HistoryQueryController(HistoryQueries historyQueries) {
        this.historyQueries = historyQueries;
    }
    
    /**
     * GET /queries/history?page=0&size=20, newest first
     */
    @GetMapping("/history")
    public ResponseEntity<DeletionHistoryPageResponse> history(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(DeletionHistoryPageResponse.from(historyQueries.list(page, size)));
    }
    
    @GetMapping("/rules/{ruleId}/stats")
    public ResponseEntity<RuleStats> ruleStats(@PathVariable Long ruleId) {
        return ResponseEntity.ok(historyQueries.ruleStats(ruleId));
    }
    
    @GetMapping("/rules/stats")
    public ResponseEntity<List<RuleStats>> allRuleStats() {
        return ResponseEntity.ok(historyQueries.allRuleStats());
    }
}
