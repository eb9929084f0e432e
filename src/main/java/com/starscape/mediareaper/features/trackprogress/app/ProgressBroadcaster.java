package com.starscape.mediareaper.features.trackprogress.app;

import com.starscape.mediareaper.features.trackprogress.api.dto.DeletionProgressUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Service for broadcasting execution progress via WebSocket.
 * Delivery is best effort: a broker problem is logged and never fails an execution pass.
 */
@Service
public class ProgressBroadcaster {
    
    public static final String DESTINATION = "/topic/deletions";
    
    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);
    
    private final SimpMessagingTemplate messagingTemplate;
    
    public ProgressBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }
    
    public void executionStarted(int totalItems) {
        send(DeletionProgressUpdate.executionStart(totalItems));
    }
    
    public void itemCompleted(Long pendingDeletionId, String title, long bytesFreed) {
        send(DeletionProgressUpdate.itemComplete(pendingDeletionId, title, bytesFreed));
    }
    
    public void itemFailed(Long pendingDeletionId, String title, String error) {
        send(DeletionProgressUpdate.itemError(pendingDeletionId, title, error));
    }
    
    public void executionCompleted(int totalItems, int successful, int failed, long bytesFreed) {
        send(DeletionProgressUpdate.executionComplete(totalItems, successful, failed, bytesFreed));
        log.info("Broadcasted execution completion to {}: successful={}/{}, failed={}",
            DESTINATION, successful, totalItems, failed);
    }
    
    private void send(DeletionProgressUpdate update) {
        try {
            messagingTemplate.convertAndSend(DESTINATION, update);
            log.debug("Broadcasted progress to {}: type={}, pendingDeletionId={}",
                DESTINATION, update.type(), update.pendingDeletionId());
        } catch (MessagingException e) {
            log.warn("Failed to broadcast progress: type={}", update.type(), e);
        }
    }
}
