package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update of an alert rule. Absent (null) fields leave the rule unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial alert rule update; omitted fields are left unchanged")
public class AlertRuleUpdate {

    @Schema(description = "Rule display name", example = "High error rate")
    private String name;

    @Schema(description = "What the rule watches for", example = "Average error rate above 5% over 5 minutes")
    private String description;

    @Schema(description = "Replacement condition")
    private AlertCondition condition;

    @Schema(description = "Alert severity", example = "critical", allowableValues = {"low", "medium", "high", "critical"})
    private Severity severity;

    @Schema(description = "Replacement channel list")
    private List<ChannelConfig> channels;

    @Schema(description = "Replacement rate limit")
    private ThrottlePolicy throttle;

    @Schema(description = "Replacement escalation policy")
    private EscalationPolicy escalation;

    @Schema(description = "Enable or disable the rule; omitted keeps the current state", example = "false")
    private Boolean enabled;
}
