package com.starscape.mediareaper.features.evaluaterule.app;

import com.starscape.mediareaper.common.config.DeletionProperties;
import com.starscape.mediareaper.common.exception.NotFoundException;
import com.starscape.mediareaper.common.exception.ValidationException;
import com.starscape.mediareaper.common.outbox.OutboxService;
import com.starscape.mediareaper.features.evaluaterule.domain.EvaluationResult;
import com.starscape.mediareaper.features.media.domain.Media;
import com.starscape.mediareaper.features.media.domain.MediaCatalog;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletion;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionRepository;
import com.starscape.mediareaper.features.pendingdeletions.domain.PendingDeletionStatus;
import com.starscape.mediareaper.features.pendingdeletions.domain.events.PendingDeletionsProposed;
import com.starscape.mediareaper.features.rules.domain.DeletionRule;
import com.starscape.mediareaper.features.rules.domain.DeletionRuleRepository;
import com.starscape.mediareaper.features.rules.domain.RuleSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a stored rule and persists one pending deletion per match that has no unresolved
 * pending deletion for the same rule yet. Each new item carries snapshots of the media
 * and of the rule as they were at this moment.
 */
@Service
public class ProposeDeletionsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ProposeDeletionsHandler.class);
    
    private final DeletionRuleRepository ruleRepository;
    private final PendingDeletionRepository pendingDeletionRepository;
    private final MediaCatalog mediaCatalog;
    private final RuleEvaluator evaluator;
    private final OutboxService outboxService;
    private final DeletionProperties properties;
    private final Clock clock;
    
    public ProposeDeletionsHandler(
            DeletionRuleRepository ruleRepository,
            PendingDeletionRepository pendingDeletionRepository,
            MediaCatalog mediaCatalog,
            RuleEvaluator evaluator,
            OutboxService outboxService,
            DeletionProperties properties,
            Clock clock) {
        this.ruleRepository = ruleRepository;
        this.pendingDeletionRepository = pendingDeletionRepository;
        this.mediaCatalog = mediaCatalog;
        this.evaluator = evaluator;
        this.outboxService = outboxService;
        this.properties = properties;
        this.clock = clock;
    }
    
    @Transactional
    public ProposalResult handle(Long ruleId) {
        DeletionRule rule = ruleRepository.findById(ruleId)
                .orElseThrow(() -> new NotFoundException("Deletion rule not found: " + ruleId));
        if (!rule.isEnabled()) {
            throw new ValidationException("Deletion rule " + ruleId + " is disabled");
        }
        
        Instant now = Instant.now(clock);
        RuleSnapshot snapshot = rule.toSnapshot(now);
        List<MediaSnapshot> candidates = mediaCatalog.findCandidates(snapshot.mediaTypes()).stream()
                .map(Media::toSnapshot)
                .toList();
        EvaluationResult result = evaluator.evaluate(snapshot, candidates, now);
        
        Set<Long> alreadyProposed = new HashSet<>(pendingDeletionRepository
                .findMediaIdsByRuleIdAndStatusIn(ruleId, PendingDeletionStatus.ACTIVE));
        
        List<Long> createdIds = new ArrayList<>();
        long createdSize = 0;
        int skipped = 0;
        for (MediaSnapshot match : result.matches()) {
            if (!alreadyProposed.add(match.id())) {
                skipped++;
                continue;
            }
            PendingDeletion saved = pendingDeletionRepository.save(new PendingDeletion(match, snapshot, now));
            createdIds.add(saved.getId());
            createdSize += match.size();
        }
        
        rule.markRun(now, properties.getRules().getTimeZone());
        ruleRepository.save(rule);
        
        if (!createdIds.isEmpty()) {
            outboxService.publish(
                new PendingDeletionsProposed(ruleId, rule.getName(), List.copyOf(createdIds), createdSize, now),
                "DeletionRule");
        }
        
        log.info("Proposed deletions: ruleId={}, evaluated={}, matched={}, created={}, alreadyPending={}, nextRun={}",
            ruleId, result.evaluatedCount(), result.matchedCount(), createdIds.size(), skipped, rule.getNextRun());
        
        return new ProposalResult(ruleId, rule.getName(), result.evaluatedCount(), result.matchedCount(),
            skipped, createdIds, createdSize);
    }
}
