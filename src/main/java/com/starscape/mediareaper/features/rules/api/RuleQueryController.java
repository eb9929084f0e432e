package com.starscape.mediareaper.features.rules.api;

import com.starscape.mediareaper.features.rules.api.dto.DeletionRuleResponse;
import com.starscape.mediareaper.features.rules.app.GetRulesHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/queries/rules")
public class RuleQueryController {
    
    private final GetRulesHandler getRulesHandler;
    
    public RuleQueryController(GetRulesHandler getRulesHandler) {
        this.getRulesHandler = getRulesHandler;
    }
    
    @GetMapping
    public ResponseEntity<List<DeletionRuleResponse>> list() {
        return ResponseEntity.ok(getRulesHandler.list().stream().map(DeletionRuleResponse::from).toList());
    }
    
    @GetMapping("/{ruleId}")
    public ResponseEntity<DeletionRuleResponse> get(@PathVariable Long ruleId) {
        return ResponseEntity.ok(DeletionRuleResponse.from(getRulesHandler.get(ruleId)));
    }
}
