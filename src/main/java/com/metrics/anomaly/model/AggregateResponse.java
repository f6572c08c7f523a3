package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.util.OptionalDouble;

@Value
@Schema(description = "Windowed aggregate of a metric")
public class AggregateResponse {

    @Schema(description = "Metric name", example = "error_rate")
    String metricName;

    @Schema(description = "Window length in minutes", example = "5")
    int windowMinutes;

    @Schema(description = "Aggregation", example = "avg")
    Aggregation aggregation;

    @Schema(description = "Aggregate value, absent when the window holds no samples", example = "0.08")
    Double value;

    @Schema(description = "True when the window holds no samples", example = "false")
    boolean noData;

    public static AggregateResponse of(String metricName, int windowMinutes, Aggregation aggregation,
                                       OptionalDouble result) {
        return result.isPresent()
                ? new AggregateResponse(metricName, windowMinutes, aggregation, result.getAsDouble(), false)
                : new AggregateResponse(metricName, windowMinutes, aggregation, null, true);
    }
}
