package com.starscape.mediareaper.features.evaluaterule.app;

import com.starscape.mediareaper.features.evaluaterule.domain.EvaluationResult;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.media.domain.MediaType;
import com.starscape.mediareaper.features.media.domain.WatchStatus;
import com.starscape.mediareaper.features.rules.domain.ConditionGroup;
import com.starscape.mediareaper.features.rules.domain.RuleCondition;
import com.starscape.mediareaper.features.rules.domain.RuleSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies a rule to media snapshots. Preview and proposal both go through here.
 * <p>
 * Protected media never matches, media outside the rule's target types never matches,
 * and every active condition (enabled group, non-blank value) must hold.
 * A rule without active conditions matches every remaining item.
 */
@Service
public class RuleEvaluator {
    
    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);
    
    private final ConditionRegistry registry;
    
    public RuleEvaluator(ConditionRegistry registry) {
        this.registry = registry;
    }
    
    public boolean matches(RuleSnapshot rule, MediaSnapshot media, Instant now) {
        return eligible(rule, media) && failingGroup(rule.activeConditions(), media, now).isEmpty();
    }
    
    public EvaluationResult evaluate(RuleSnapshot rule, Collection<MediaSnapshot> media, Instant now) {
        List<RuleCondition> active = rule.activeConditions();
        List<MediaSnapshot> matches = new ArrayList<>();
        Map<MediaType, Long> byType = new EnumMap<>(MediaType.class);
        Map<WatchStatus, Long> byWatchStatus = new EnumMap<>(WatchStatus.class);
        Map<ConditionGroup, Long> excluded = new EnumMap<>(ConditionGroup.class);
        long totalSize = 0;
        
        for (MediaSnapshot item : media) {
            if (!eligible(rule, item)) {
                continue;
            }
            Optional<ConditionGroup> failed = failingGroup(active, item, now);
            if (failed.isPresent()) {
                excluded.merge(failed.get(), 1L, Long::sum);
                continue;
            }
            matches.add(item);
            totalSize += item.size();
            byType.merge(item.type(), 1L, Long::sum);
            byWatchStatus.merge(item.watchStatus(), 1L, Long::sum);
        }
        
        matches.sort(Comparator.comparingLong(MediaSnapshot::size).reversed());
        log.debug("Evaluated rule: ruleId={}, evaluated={}, matched={}, totalSize={}, excluded={}",
            rule.ruleId(), media.size(), matches.size(), totalSize, excluded);
        
        return new EvaluationResult(matches, media.size(), totalSize, byType, byWatchStatus, excluded);
    }
    
    private boolean eligible(RuleSnapshot rule, MediaSnapshot media) {
        return !media.protectedItem() && rule.targets(media.type());
    }
    
    private Optional<ConditionGroup> failingGroup(List<RuleCondition> conditions, MediaSnapshot media, Instant now) {
        for (RuleCondition condition : conditions) {
            if (!registry.evaluatorFor(condition.kind()).test(media, condition, now)) {
                return Optional.of(condition.kind().group());
            }
        }
        return Optional.empty();
    }
}
