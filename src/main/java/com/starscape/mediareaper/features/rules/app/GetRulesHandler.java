package com.starscape.mediareaper.features.rules.app;

import com.starscape.mediareaper.common.exception.NotFoundException;
import com.starscape.mediareaper.features.rules.domain.DeletionRule;
import com.starscape.mediareaper.features.rules.domain.DeletionRuleRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class GetRulesHandler {
    
    private final DeletionRuleRepository ruleRepository;
    
    public GetRulesHandler(DeletionRuleRepository ruleRepository) {
        this.ruleRepository = ruleRepository;
    }
    
    @Transactional(readOnly = true)
    public List<DeletionRule> list() {
        return ruleRepository.findAllByOrderByCreatedAtAsc();
    }
    
    @Transactional(readOnly = true)
    public DeletionRule get(Long ruleId) {
        return ruleRepository.findById(ruleId)
                .orElseThrow(() -> new NotFoundException("Deletion rule not found: " + ruleId));
    }
}
