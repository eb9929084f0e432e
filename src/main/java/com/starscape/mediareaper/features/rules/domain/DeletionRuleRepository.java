package com.starscape.mediareaper.features.rules.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DeletionRuleRepository {
    DeletionRule save(DeletionRule rule);
    Optional<DeletionRule> findById(Long ruleId);
    List<DeletionRule> findAllByOrderByCreatedAtAsc();
    List<DeletionRule> findDueRules(Instant now);
    void delete(DeletionRule rule);
}
