package com.starscape.mediareaper.features.rules.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.common.exception.NotFoundException;
import com.starscape.mediareaper.features.rules.api.dto.DeletionRuleRequest;
import com.starscape.mediareaper.features.rules.domain.DeletionRule;
import com.starscape.mediareaper.features.rules.domain.DeletionRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Replaces a rule definition. Pending deletions proposed earlier keep their rule snapshot.
 */
@Service
public class UpdateRuleHandler {
    
    private static final Logger log = LoggerFactory.getLogger(UpdateRuleHandler.class);
    
    private final DeletionRuleRepository ruleRepository;
    private final RuleValidator validator;
    private final DeletionProperties properties;
    private final Clock clock;
    
    public UpdateRuleHandler(DeletionRuleRepository ruleRepository, RuleValidator validator,
                             DeletionProperties properties, Clock clock) {
        this.ruleRepository = ruleRepository;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
    }
    
    @Transactional
    public DeletionRule handle(Long ruleId, DeletionRuleRequest request) {
        DeletionRule rule = ruleRepository.findById(ruleId)
                .orElseThrow(() -> new NotFoundException("Deletion rule not found: " + ruleId));
        validator.validate(request.conditions(), request.schedule());
        
        rule.update(
            request.name(),
            request.description(),
            request.enabledOrDefault(),
            request.mediaTypes(),
            request.conditions(),
            request.filtersEnabled(),
            request.deletionStrategy(),
            request.schedule(),
            Instant.now(clock),
            properties.getRules().getTimeZone()
        );
        DeletionRule saved = ruleRepository.save(rule);
        log.info("Updated deletion rule: ruleId={}, enabled={}, nextRun={}", ruleId, saved.isEnabled(), saved.getNextRun());
        return saved;
    }
}
