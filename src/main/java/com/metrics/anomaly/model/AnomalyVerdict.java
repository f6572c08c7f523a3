package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Fused anomaly decision across all detection strategies")
public class AnomalyVerdict {

    @Schema(description = "True when at least one strategy flagged the value", example = "true")
    boolean anomaly;

    @Schema(description = "Highest confidence reported by any strategy (0-1)", example = "1.0")
    double confidence;

    @Schema(description = "Confidence reported by each strategy",
            example = "{\"statistical\": 1.0, \"time-series\": 0.8, \"contextual\": 0.0, \"reconstruction\": 0.0}")
    Map<String, Double> perStrategy;

    @Schema(description = "Strategies that flagged the value", example = "[\"statistical\", \"time-series\"]")
    List<String> flaggedBy;

    @Schema(description = "Evaluation timestamp in epoch milliseconds", example = "1739886764000")
    long evaluatedAt;
}
