package com.starscape.mediareaper.features.pendingdeletions.api.dto;

import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import org.springframework.data.domain.Page;

import java.util.List;

public record PendingDeletionListResponse(
    List<PendingDeletionResponse> items,
    int page,
    int size,
    long totalElements,
    int totalPages
) {
    
    public static PendingDeletionListResponse from(Page<PendingDeletion> page) {
        return new PendingDeletionListResponse(
            page.getContent().stream().map(PendingDeletionResponse::from).toList(),
            page.getNumber(),
            page.getSize(),
            page.getTotalElements(),
            page.getTotalPages()
        );
    }
}
