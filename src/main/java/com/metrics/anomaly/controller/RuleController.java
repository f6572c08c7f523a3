package com.metrics.anomaly.controller;

import com.metrics.anomaly.model.AlertRule;
import com.metrics.anomaly.model.AlertRuleUpdate;
import com.metrics.anomaly.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Manage alert rules (CRUD + enable/disable)")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List all alert rules",
            description = "Returns every configured rule, ordered by id, including disabled rules.")
    @GetMapping
    public ResponseEntity<List<AlertRule>> listRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @Operation(summary = "Get a specific rule by ID")
    @GetMapping("/{ruleId}")
    public ResponseEntity<AlertRule> getRule(
            @Parameter(description = "Rule ID", example = "RULE-ERROR-RATE")
            @PathVariable String ruleId) {
        return ResponseEntity.ok(ruleService.getRule(ruleId));
    }

    @Operation(summary = "Create or replace an alert rule",
            description = "Adds the rule. A rule with the same id is replaced. A missing id is generated.")
    @PostMapping
    public ResponseEntity<AlertRule> createRule(@RequestBody AlertRule rule) {
        return ResponseEntity.ok(ruleService.createRule(rule));
    }

    @Operation(summary = "Update an existing rule",
            description = "Change the condition, severity, channels, throttle or escalation, or enable/disable the rule.")
    @PutMapping("/{ruleId}")
    public ResponseEntity<AlertRule> updateRule(
            @Parameter(description = "Rule ID", example = "RULE-ERROR-RATE")
            @PathVariable String ruleId,
            @RequestBody AlertRuleUpdate updated) {
        return ResponseEntity.ok(ruleService.updateRule(ruleId, updated));
    }

    @Operation(summary = "Delete a rule",
            description = "Also cancels the rule's pending escalations and clears its throttle window.")
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(
            @Parameter(description = "Rule ID", example = "RULE-ERROR-RATE")
            @PathVariable String ruleId) {
        boolean deleted = ruleService.deleteRule(ruleId);
        if (!deleted) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
