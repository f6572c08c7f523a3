package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Result of ingesting one metric sample")
public class IngestionResult {

    @Schema(description = "Metric name", example = "response_time")
    String metricName;

    @Schema(description = "Sample timestamp in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Whether the sample was stored", example = "true")
    boolean accepted;

    @Schema(description = "Anomaly verdict computed against prior history; absent when rejected")
    AnomalyVerdict verdict;

    @Schema(description = "Rejection reason; absent when accepted", example = "Out-of-order timestamp")
    String error;
}
