package com.starscape.mediareaper.features.history.infra;

import com.starscape.mediareaper.features.history.domain.DeletionHistory;
import com.starscape.mediareaper.features.history.domain.DeletionHistoryRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaDeletionHistoryRepository extends JpaRepository<DeletionHistory, Long>, DeletionHistoryRepository {
    
    Page<DeletionHistory> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);
    
    List<DeletionHistory> findAllByOrderByCreatedAtAsc();
}
