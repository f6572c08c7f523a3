package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.util.List;

@Value
@Schema(description = "A pending escalation held in the escalation queue")
public class EscalationTask {

    @Schema(description = "Alert being escalated")
    String alertId;

    @Schema(description = "Rule that raised the alert")
    String ruleId;

    @Schema(description = "Due time in epoch milliseconds")
    long fireAt;

    @Schema(description = "Escalation channels")
    List<ChannelConfig> channels;

    @Schema(description = "Original alert")
    Alert alert;
}
