package com.starscape.mediareaper.features.executedeletions.api;

import com.starscape.mediareaper.features.executedeletions.api.dto.StartScheduleRequest;
import com.starscape.mediareaper.features.executedeletions.app.ExecutionEngine;
import com.starscape.mediareaper.features.executedeletions.app.ExecutionScheduler;
import com.starscape.mediareaper.features.executedeletions.app.ExecutionStatus;
import com.starscape.mediareaper.features.executedeletions.domain.ExecutionOutcome;
import com.starscape.mediareaper.features.executedeletions.domain.ExecutionSummary;
import com.starscape.mediareaper.features.history.domain.ExecutionTrigger;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
public class ExecutionController {
    
    private final ExecutionEngine executionEngine;
    private final ExecutionScheduler executionScheduler;
    
    public ExecutionController(ExecutionEngine executionEngine, ExecutionScheduler executionScheduler) {
        this.executionEngine = executionEngine;
        this.executionScheduler = executionScheduler;
    }
    
    /**
     * Execute all eligible pending deletions now.
     * POST /commands/executions
     * Returns 409 with the BUSY summary when a pass is already running.
     */
    @PostMapping("/commands/executions")
    public ResponseEntity<ExecutionSummary> executeNow() {
        ExecutionSummary summary = executionEngine.executeNow(ExecutionTrigger.MANUAL);
        if (summary.outcome() == ExecutionOutcome.BUSY) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(summary);
        }
        return ResponseEntity.ok(summary);
    }
    
    /**
     * GET /queries/executions/status
     */
    @GetMapping("/queries/executions/status")
    public ResponseEntity<ExecutionStatus> status() {
        return ResponseEntity.ok(executionScheduler.status());
    }
    
    /**
     * POST /commands/executions/schedule/start
     */
    @PostMapping("/commands/executions/schedule/start")
    public ResponseEntity<ExecutionStatus> startSchedule(@Valid @RequestBody StartScheduleRequest request) {
        return ResponseEntity.ok(executionScheduler.start(request.intervalMinutes()));
    }
    
    /**
     * POST /commands/executions/schedule/stop
     */
    @PostMapping("/commands/executions/schedule/stop")
    public ResponseEntity<ExecutionStatus> stopSchedule() {
        return ResponseEntity.ok(executionScheduler.stop());
    }
}
