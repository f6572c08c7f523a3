package com.metrics.anomaly.controller;

import com.metrics.anomaly.escalation.EscalationScheduler;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.EscalationTask;
import com.metrics.anomaly.service.AlertingService;
import com.metrics.anomaly.service.CycleSummary;
import com.metrics.anomaly.throttle.ThrottleController;
import com.metrics.anomaly.throttle.ThrottleState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Raised alerts, on-demand evaluation, throttle and escalation state")
public class AlertController {

    private final AlertingService alertingService;
    private final ThrottleController throttleController;
    private final EscalationScheduler escalationScheduler;

    public AlertController(AlertingService alertingService, ThrottleController throttleController,
                           EscalationScheduler escalationScheduler) {
        this.alertingService = alertingService;
        this.throttleController = throttleController;
        this.escalationScheduler = escalationScheduler;
    }

    @Operation(summary = "Recent alerts", description = "Alerts raised by recent evaluation cycles, newest first.")
    @GetMapping
    public ResponseEntity<List<Alert>> recentAlerts(
            @Parameter(description = "Maximum alerts returned", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(alertingService.recentAlerts(limit));
    }

    @Operation(summary = "Run an evaluation cycle now",
            description = "Evaluates all enabled rules immediately. Dispatch continues in the background.")
    @PostMapping("/evaluate")
    public ResponseEntity<CycleSummary> evaluate() {
        return ResponseEntity.ok(alertingService.evaluateNow());
    }

    @Operation(summary = "Throttle window of a rule")
    @GetMapping("/throttle/{ruleId}")
    public ResponseEntity<ThrottleState> throttleState(
            @Parameter(description = "Rule ID", example = "RULE-ERROR-RATE")
            @PathVariable String ruleId) {
        return throttleController.state(ruleId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Pending escalations", description = "Queued escalations ordered by due time.")
    @GetMapping("/escalations")
    public ResponseEntity<List<EscalationTask>> pendingEscalations() {
        return ResponseEntity.ok(escalationScheduler.pending());
    }

    @Operation(summary = "Cancel a pending escalation")
    @DeleteMapping("/escalations/{alertId}")
    public ResponseEntity<Void> cancelEscalation(
            @Parameter(description = "Alert ID") @PathVariable String alertId) {
        if (!escalationScheduler.cancel(alertId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
