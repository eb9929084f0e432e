package com.starscape.mediareaper.features.evaluaterule.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.features.rules.domain.DeletionRule;
import com.starscape.mediareaper.features.rules.domain.DeletionRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Proposes deletions for every enabled rule whose own schedule is due.
 * A failing rule is logged, does not hold back the others and waits for its next slot.
 */
@Component
public class RuleScheduleRunner {
    
    private static final Logger log = LoggerFactory.getLogger(RuleScheduleRunner.class);
    
    private final DeletionRuleRepository ruleRepository;
    private final ProposeDeletionsHandler proposeDeletionsHandler;
    private final DeletionProperties properties;
    private final Clock clock;
    
    public RuleScheduleRunner(
            DeletionRuleRepository ruleRepository,
            ProposeDeletionsHandler proposeDeletionsHandler,
            DeletionProperties properties,
            Clock clock) {
        this.ruleRepository = ruleRepository;
        this.proposeDeletionsHandler = proposeDeletionsHandler;
        this.properties = properties;
        this.clock = clock;
    }
    
    @Scheduled(fixedDelayString = "${app.deletion.rules.check-interval:PT1M}")
    public void runDueRules() {
        if (!properties.getRules().isScheduledRunsEnabled()) {
            return;
        }
        List<DeletionRule> due = ruleRepository.findDueRules(Instant.now(clock));
        if (due.isEmpty()) {
            return;
        }
        log.info("Running {} scheduled deletion rules", due.size());
        int proposed = 0;
        for (DeletionRule rule : due) {
            try {
                proposed += proposeDeletionsHandler.handle(rule.getId()).createdIds().size();
            } catch (RuntimeException e) {
                log.error("Scheduled run failed: ruleId={}, name={}", rule.getId(), rule.getName(), e);
                postpone(rule.getId());
            }
        }
        log.info("Scheduled rule runs finished: rules={}, proposed={}", due.size(), proposed);
    }
    
    private void postpone(Long ruleId) {
        try {
            ruleRepository.findById(ruleId).ifPresent(rule -> {
                rule.postponeAfter(Instant.now(clock), properties.getRules().getTimeZone());
                ruleRepository.save(rule);
                log.info("Postponed failed rule: ruleId={}, nextRun={}", ruleId, rule.getNextRun());
            });
        } catch (RuntimeException e) {
            log.error("Could not postpone failed rule, it will be retried on the next check: ruleId={}", ruleId, e);
        }
    }
}
