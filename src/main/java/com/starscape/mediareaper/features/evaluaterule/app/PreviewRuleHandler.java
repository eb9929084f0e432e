package com.starscape.mediareaper.features.evaluaterule.app;

import com.starscape.mediareaper.features.evaluaterule.domain.EvaluationResult;
import com.starscape.mediareaper.features.media.domain.Media;
import com.starscape.mediareaper.features.media.domain.MediaCatalog;
import com.starscape.mediareaper.features.media.domain.MediaSnapshot;
import com.starscape.mediareaper.features.rules.api.dto.DeletionRuleRequest;
import com.starscape.mediareaper.features.rules.app.GetRulesHandler;
import com.starscape.mediareaper.features.rules.app.RuleValidator;
import com.starscape.mediareaper.features.rules.domain.RuleSnapshot;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Evaluates a rule against the live library without persisting anything.
 */
@Service
public class PreviewRuleHandler {
    
    private final MediaCatalog mediaCatalog;
    private final RuleEvaluator evaluator;
    private final RuleValidator validator;
    private final GetRulesHandler getRulesHandler;
    private final Clock clock;
    
    public PreviewRuleHandler(MediaCatalog mediaCatalog, RuleEvaluator evaluator, RuleValidator validator,
                              GetRulesHandler getRulesHandler, Clock clock) {
        this.mediaCatalog = mediaCatalog;
        this.evaluator = evaluator;
        this.validator = validator;
        this.getRulesHandler = getRulesHandler;
        this.clock = clock;
    }
    
    /**
     * Preview an unsaved definition.
     */
    @Transactional(readOnly = true)
    public EvaluationResult preview(DeletionRuleRequest definition) {
        validator.validate(definition.conditions(), null);
        Instant now = Instant.now(clock);
        RuleSnapshot rule = new RuleSnapshot(
            null,
            definition.name(),
            definition.mediaTypes(),
            definition.conditions(),
            definition.filtersEnabled(),
            definition.deletionStrategy(),
            now
        );
        return evaluate(rule, now);
    }
    
    /**
     * Preview a stored rule as it is now, regardless of whether it is enabled.
     */
    @Transactional(readOnly = true)
    public EvaluationResult previewStored(Long ruleId) {
        Instant now = Instant.now(clock);
        return evaluate(getRulesHandler.get(ruleId).toSnapshot(now), now);
    }
    
    private EvaluationResult evaluate(RuleSnapshot rule, Instant now) {
        List<MediaSnapshot> candidates = mediaCatalog.findCandidates(rule.mediaTypes()).stream()
                .map(Media::toSnapshot)
                .toList();
        return evaluator.evaluate(rule, candidates, now);
    }
}
