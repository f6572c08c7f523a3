package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Notification payload produced when a rule fires and passes throttling. Immutable.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "An alert raised by a fired rule")
public class Alert {

    @Schema(description = "Alert identifier", example = "6f1c7f0e-3c1e-4c8a-9b7e-0c1d2e3f4a5b")
    String id;

    @Schema(description = "Rule that fired", example = "RULE-ERROR-RATE")
    String ruleId;

    @Schema(description = "Rule display name", example = "High error rate")
    String ruleName;

    @Schema(description = "Alert severity", example = "high")
    Severity severity;

    @Schema(description = "Human-readable message",
            example = "[HIGH] High error rate: avg(error_rate) over 5m = 0.0800 > 0.0500")
    String message;

    @Schema(description = "Alert timestamp in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Metric the rule evaluated", example = "error_rate")
    String metric;

    @Schema(description = "Aggregate value that breached the threshold", example = "0.08")
    double aggregateValue;

    @Schema(description = "Raw sample values inside the rule window")
    List<Double> values;

    @Schema(description = "Identifier linking this alert to related records", example = "0d3c9a4e-1b2f-4e5d-8a7b-6c5d4e3f2a1b")
    String correlationId;

    @Schema(description = "True for escalation notifications", example = "false")
    boolean escalation;
}
