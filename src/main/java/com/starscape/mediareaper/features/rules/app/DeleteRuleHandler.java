package com.starscape.mediareaper.features.rules.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.common.exception.NotFoundException;
import com.starscape.mediareaper.features.pendingdeletions.app.PendingDeletionLifecycle;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionRepository;
import com.starscape.mediareaper.features.rules.domain.DeletionRule;
import com.starscape.mediareaper.features.rules.domain.DeletionRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Deletes a rule. Its unresolved pending deletions are cancelled and every pending deletion
 * it produced is detached; history rows keep the denormalised rule name.
 */
@Service
public class DeleteRuleHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteRuleHandler.class);
    
    private final DeletionRuleRepository ruleRepository;
    private final PendingDeletionRepository pendingDeletionRepository;
    private final DeletionProperties properties;
    private final Clock clock;
    
    public DeleteRuleHandler(DeletionRuleRepository ruleRepository,
                             PendingDeletionRepository pendingDeletionRepository,
                             DeletionProperties properties,
                             Clock clock) {
        this.ruleRepository = ruleRepository;
        this.pendingDeletionRepository = pendingDeletionRepository;
        this.properties = properties;
        this.clock = clock;
    }
    
    @Transactional
    public void handle(Long ruleId) {
        DeletionRule rule = ruleRepository.findById(ruleId)
                .orElseThrow(() -> new NotFoundException("Deletion rule not found: " + ruleId));
        
        Instant now = Instant.now(clock);
        List<PendingDeletion> produced = pendingDeletionRepository.findByRuleId(ruleId);
        int cancelled = 0;
        for (PendingDeletion item : produced) {
            if (item.getStatus().isActive() && !item.isLeased(now, properties.getExecution().getLeaseTimeout())) {
                item.cancel(PendingDeletionLifecycle.SYSTEM_ACTOR, "Rule deleted", now,
                    properties.getExecution().getLeaseTimeout());
                cancelled++;
            }
            item.detachRule();
            pendingDeletionRepository.save(item);
        }
        
        ruleRepository.delete(rule);
        log.info("Deleted deletion rule: ruleId={}, name={}, cancelledPending={}, detached={}",
            ruleId, rule.getName(), cancelled, produced.size());
    }
}
