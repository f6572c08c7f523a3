package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A metric sample submitted for ingestion")
public class MetricSampleRequest {

    @Schema(description = "Metric name", example = "response_time")
    private String metricName;

    @Schema(description = "Observed value. Must be finite.", example = "212.5")
    private Double value;

    @Schema(description = "Sample timestamp in epoch milliseconds. Defaults to current time if not provided.",
            example = "1739886764000")
    private Long timestamp;

    @Schema(description = "Optional context tags", example = "{\"host\": \"api-1\"}")
    @Builder.Default
    private Map<String, String> context = new HashMap<>();
}
