package com.starscape.mediareaper.features.rules.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.features.rules.api.dto.DeletionRuleRequest;
import com.starscape.mediareaper.features.rules.domain.DeletionRule;
import com.starscape.mediareaper.features.rules.domain.DeletionRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Service
public class CreateRuleHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CreateRuleHandler.class);
    
    private final DeletionRuleRepository ruleRepository;
    private final RuleValidator validator;
    private final DeletionProperties properties;
    private final Clock clock;
    
    public CreateRuleHandler(DeletionRuleRepository ruleRepository, RuleValidator validator,
                             DeletionProperties properties, Clock clock) {
        this.ruleRepository = ruleRepository;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
    }
    
    @Transactional
    public DeletionRule handle(DeletionRuleRequest request) {
        validator.validate(request.conditions(), request.schedule());
        
        DeletionRule rule = new DeletionRule(
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
        log.info("Created deletion rule: ruleId={}, name={}, nextRun={}", saved.getId(), saved.getName(), saved.getNextRun());
        return saved;
    }
}
