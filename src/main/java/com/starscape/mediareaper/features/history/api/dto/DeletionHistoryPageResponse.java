package com.starscape.mediareaper.features.history.api.dto;

import com.starscape.mediareaper.features.history.domain.DeletionHistory;
import org.springframework.data.domain.Page;

import java.util.List;

public record DeletionHistoryPageResponse(
    List<DeletionHistoryResponse> items,
    int page,
    int size,
    long totalElements,
    int totalPages
) {
    
    public static DeletionHistoryPageResponse from(Page<DeletionHistory> page) {
        return new DeletionHistoryPageResponse(
            page.getContent().stream().map(DeletionHistoryResponse::from).toList(),
            page.getNumber(),
            page.getSize(),
            page.getTotalElements(),
            page.getTotalPages()
        );
    }
}
