package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Declarative alert rule evaluated on every evaluation tick")
public class AlertRule {

    @Schema(description = "Unique rule identifier. Re-adding an existing id replaces the rule.", example = "RULE-ERROR-RATE")
    private String id;

    @Schema(description = "Rule display name", example = "High error rate")
    private String name;

    @Schema(description = "What the rule watches for", example = "Average error rate above 5% over 5 minutes")
    private String description;

    @Schema(description = "Condition evaluated against the metric window")
    private AlertCondition condition;

    @Schema(description = "Alert severity", example = "high", allowableValues = {"low", "medium", "high", "critical"})
    @Builder.Default
    private Severity severity = Severity.MEDIUM;

    @Schema(description = "Channels notified when the rule fires")
    @Builder.Default
    private List<ChannelConfig> channels = new ArrayList<>();

    @Schema(description = "Optional rate limit on notifications")
    private ThrottlePolicy throttle;

    @Schema(description = "Optional deferred escalation")
    private EscalationPolicy escalation;

    @Schema(description = "Whether the rule is evaluated", example = "true")
    @Builder.Default
    private boolean enabled = true;
}
