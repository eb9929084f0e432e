package com.starscape.mediareaper.features.pendingdeletions.api;

import com.starscape.mediareaper.features.pendingdeletions.api.dto.ApproveRequest;
import com.starscape.mediareaper.features.pendingdeletions.api.dto.BulkApproveRequest;
import com.starscape.mediareaper.features.pendingdeletions.api.dto.BulkCancelRequest;
import com.starscape.mediareaper.features.pendingdeletions.api.dto.BulkOperationResponse;
import com.starscape.mediareaper.features.pendingdeletions.api.dto.CancelRequest;
import com.starscape.mediareaper.features.pendingdeletions.api.dto.PendingDeletionResponse;
import com.starscape.mediareaper.features.pendingdeletions.api.dto.ResubmitRequest;
import com.starscape.mediareaper.features.pendingdeletions.app.PendingDeletionLifecycle;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Operator actions on pending deletions.
 * Execution outcomes (completed, failed) are never set through this controller.
 */
@RestController
@RequestMapping("/commands/pending-deletions")
public class PendingDeletionCommandController {
    
    private final PendingDeletionLifecycle lifecycle;
    
    public PendingDeletionCommandController(PendingDeletionLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }
    
    /**
     * POST /commands/pending-deletions/{id}/approve
     */
    @PostMapping("/{id}/approve")
    public ResponseEntity<PendingDeletionResponse> approve(
            @PathVariable Long id,
            @RequestBody(required = false) ApproveRequest request) {
        ApproveRequest body = request != null ? request : new ApproveRequest(null, null, null);
        return ResponseEntity.ok(PendingDeletionResponse.from(
            lifecycle.approve(id, body.actor(), body.scheduledDate(), body.reason())));
    }
    
    /**
     * POST /commands/pending-deletions/{id}/cancel
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<PendingDeletionResponse> cancel(
            @PathVariable Long id,
            @RequestBody(required = false) CancelRequest request) {
        CancelRequest body = request != null ? request : new CancelRequest(null, null);
        return ResponseEntity.ok(PendingDeletionResponse.from(
            lifecycle.cancel(id, body.actor(), body.reason())));
    }
    
    /**
     * Queue a failed item for another execution attempt.
     * POST /commands/pending-deletions/{id}/resubmit
     */
    @PostMapping("/{id}/resubmit")
    public ResponseEntity<PendingDeletionResponse> resubmit(
            @PathVariable Long id,
            @RequestBody(required = false) ResubmitRequest request) {
        String actor = request != null ? request.actor() : null;
        return ResponseEntity.ok(PendingDeletionResponse.from(lifecycle.resubmit(id, actor)));
    }
    
    /**
     * POST /commands/pending-deletions/bulk-approve
     */
    @PostMapping("/bulk-approve")
    public ResponseEntity<BulkOperationResponse> bulkApprove(@Valid @RequestBody BulkApproveRequest request) {
        return ResponseEntity.ok(BulkOperationResponse.from(
            lifecycle.bulkApprove(request.ids(), request.actor(), request.scheduledDate(), request.reason())));
    }
    
    /**
     * POST /commands/pending-deletions/bulk-cancel
     */
    @PostMapping("/bulk-cancel")
    public ResponseEntity<BulkOperationResponse> bulkCancel(@Valid @RequestBody BulkCancelRequest request) {
        return ResponseEntity.ok(BulkOperationResponse.from(
            lifecycle.bulkCancel(request.ids(), request.actor(), request.reason())));
    }
}
