package com.starscape.mediareaper.features.rules.api;

import com.starscape.mediareaper.features.rules.api.dto.DeletionRuleRequest;
import com.starscape.mediareaper.features.rules.api.dto.DeletionRuleResponse;
import com.starscape.mediareaper.features.rules.app.CreateRuleHandler;
import com.starscape.mediareaper.features.rules.app.DeleteRuleHandler;
import com.starscape.mediareaper.features.rules.app.UpdateRuleHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands/rules")
public class RuleCommandController {
    
    private final CreateRuleHandler createRuleHandler;
    private final UpdateRuleHandler updateRuleHandler;
    private final DeleteRuleHandler deleteRuleHandler;
    
    public RuleCommandController(
            CreateRuleHandler createRuleHandler,
            UpdateRuleHandler updateRuleHandler,
            DeleteRuleHandler deleteRuleHandler) {
        this.createRuleHandler = createRuleHandler;
        this.updateRuleHandler = updateRuleHandler;
        this.deleteRuleHandler = deleteRuleHandler;
    }
    
    /**
     * POST /commands/rules
     */
    @PostMapping
    public ResponseEntity<DeletionRuleResponse> create(@Valid @RequestBody DeletionRuleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(DeletionRuleResponse.from(createRuleHandler.handle(request)));
    }
    
    /**
     * PUT /commands/rules/{ruleId}
     */
    @PutMapping("/{ruleId}")
    public ResponseEntity<DeletionRuleResponse> update(
            @PathVariable Long ruleId,
            @Valid @RequestBody DeletionRuleRequest request) {
        return ResponseEntity.ok(DeletionRuleResponse.from(updateRuleHandler.handle(ruleId, request)));
    }
    
    /**
     * DELETE /commands/rules/{ruleId}
     */
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> delete(@PathVariable Long ruleId) {
        deleteRuleHandler.handle(ruleId);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}
