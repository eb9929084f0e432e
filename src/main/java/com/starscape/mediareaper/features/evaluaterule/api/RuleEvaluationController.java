package com.starscape.mediareaper.features.evaluaterule.api;

import com.starscape.mediareaper.features.evaluaterule.api.dto.PreviewResponse;
import com.starscape.mediareaper.features.evaluaterule.app.PreviewRuleHandler;
import com.starscape.mediareaper.features.evaluaterule.app.ProposalResult;
import com.starscape.mediareaper.features.evaluaterule.app.ProposeDeletionsHandler;
import com.starscape.mediareaper.features.rules.api.dto.DeletionRuleRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Preview (no side effects) and proposal runs of deletion rules.
 */
@RestController
public class RuleEvaluationController {
    
    private final PreviewRuleHandler previewRuleHandler;
    private final ProposeDeletionsHandler proposeDeletionsHandler;
    
    public RuleEvaluationController(PreviewRuleHandler previewRuleHandler,
                                    ProposeDeletionsHandler proposeDeletionsHandler) {
        this.previewRuleHandler = previewRuleHandler;
        this.proposeDeletionsHandler = proposeDeletionsHandler;
    }
    
    /**
     * Preview an unsaved rule definition.
     * POST /queries/rules/preview
     */
    @PostMapping("/queries/rules/preview")
    public ResponseEntity<PreviewResponse> preview(@Valid @RequestBody DeletionRuleRequest request) {
        return ResponseEntity.ok(PreviewResponse.from(previewRuleHandler.preview(request)));
    }
    
    /**
     * GET /queries/rules/{ruleId}/preview
     */
    @GetMapping("/queries/rules/{ruleId}/preview")
    public ResponseEntity<PreviewResponse> previewStored(@PathVariable Long ruleId) {
        return ResponseEntity.ok(PreviewResponse.from(previewRuleHandler.previewStored(ruleId)));
    }
    
    /**
     * Run a rule now and create pending deletions for its matches.
     * POST /commands/rules/{ruleId}/run
     */
    @PostMapping("/commands/rules/{ruleId}/run")
    public ResponseEntity<ProposalResult> run(@PathVariable Long ruleId) {
        return ResponseEntity.ok(proposeDeletionsHandler.handle(ruleId));
    }
}
