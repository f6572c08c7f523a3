package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

/**
 * A single timestamped observation of a named metric. Immutable once created.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Schema(description = "A timestamped metric observation held in a metric window")
public class MetricSample {

    @Schema(description = "Metric name", example = "response_time")
    String metricName;

    @Schema(description = "Sample timestamp in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Observed value", example = "212.5")
    double value;

    @Schema(description = "Context tags attached to the sample", example = "{\"region\": \"eu-west-1\"}")
    Map<String, String> context;

    public static MetricSample of(String metricName, long timestamp, double value, Map<String, String> context) {
        return new MetricSample(metricName, timestamp, value,
                context == null ? Map.of() : Map.copyOf(context));
    }

    public static MetricSample of(String metricName, long timestamp, double value) {
        return of(metricName, timestamp, value, Map.of());
    }
}
