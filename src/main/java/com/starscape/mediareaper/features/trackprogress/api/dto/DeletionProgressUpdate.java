package com.starscape.mediareaper.features.trackprogress.api.dto;

import java.time.Instant;

/**
 * Execution progress message sent to /topic/deletions.
 * {@code type} is one of execution_start, item_complete, item_error, execution_complete.
 */
public record DeletionProgressUpdate(
    String type,
    Long pendingDeletionId,
    String title,
    Integer totalItems,
    Integer successful,
    Integer failed,
    Long bytesFreed,
    String message,
    Instant timestamp
) {
    
    public static DeletionProgressUpdate executionStart(int totalItems) {
        return new DeletionProgressUpdate("execution_start", null, null, totalItems, null, null, null,
            "Starting execution of " + totalItems + " deletions", Instant.now());
    }
    
    public static DeletionProgressUpdate itemComplete(Long pendingDeletionId, String title, long bytesFreed) {
        return new DeletionProgressUpdate("item_complete", pendingDeletionId, title, null, null, null, bytesFreed,
            "Deleted " + title, Instant.now());
    }
    
    public static DeletionProgressUpdate itemError(Long pendingDeletionId, String title, String error) {
        return new DeletionProgressUpdate("item_error", pendingDeletionId, title, null, null, null, null,
            error, Instant.now());
    }
    
    public static DeletionProgressUpdate executionComplete(int totalItems, int successful, int failed, long bytesFreed) {
        return new DeletionProgressUpdate("execution_complete", null, null, totalItems, successful, failed, bytesFreed,
            "Execution finished: " + successful + " deleted, " + failed + " failed", Instant.now());
    }
}
