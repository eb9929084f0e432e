package com.starscape.mediareaper.features.history.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;

public interface DeletionHistoryRepository {
    DeletionHistory save(DeletionHistory history);
    Page<DeletionHistory> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);
    List<DeletionHistory> findAllByOrderByCreatedAtAsc();
    long count();
}
