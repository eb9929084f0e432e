package com.starscape.mediareaper.features.rules.infra;

import com.starscape.mediareaper.features.rules.domain.DeletionRule;
import com.starscape.mediareaper.features.rules.domain.DeletionRuleRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface JpaDeletionRuleRepository extends JpaRepository<DeletionRule, Long>, DeletionRuleRepository {
    
    List<DeletionRule> findAllByOrderByCreatedAtAsc();
    
    @Override
    @Query("SELECT r FROM DeletionRule r WHERE r.enabled = true AND r.nextRun IS NOT NULL AND r.nextRun <= :now ORDER BY r.nextRun ASC")
    List<DeletionRule> findDueRules(@Param("now") Instant now);
}
