package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Threshold condition evaluated against a windowed aggregate")
public class AlertCondition {

    @Schema(description = "Metric the condition reads. Use '<metric>.anomaly_confidence' to react to anomaly verdicts.",
            example = "error_rate")
    private String metric;

    @Schema(description = "Comparison operator", example = ">", allowableValues = {">", "<", ">=", "<=", "==", "!="})
    private ComparisonOperator operator;

    @Schema(description = "Threshold compared against the aggregate", example = "0.05")
    private double threshold;

    @Schema(description = "Trailing window length in minutes", example = "5")
    private int windowMinutes;

    @Schema(description = "Aggregation applied over the window", example = "avg",
            allowableValues = {"avg", "sum", "min", "max", "count"})
    private Aggregation aggregation;

    public boolean matches(double aggregateValue) {
        return operator.test(aggregateValue, threshold);
    }
}
