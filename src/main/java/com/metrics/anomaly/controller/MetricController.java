package com.metrics.anomaly.controller;

import com.metrics.anomaly.model.AggregateResponse;
import com.metrics.anomaly.model.Aggregation;
import com.metrics.anomaly.model.AnomalyVerdict;
import com.metrics.anomaly.model.IngestionResult;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.MetricSampleRequest;
import com.metrics.anomaly.service.MetricIngestionService;
import com.metrics.anomaly.store.MetricWindowStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Metrics", description = "Metric ingestion, windowed aggregates and anomaly verdicts")
public class MetricController {

    private final MetricIngestionService ingestionService;
    private final MetricWindowStore store;

    public MetricController(MetricIngestionService ingestionService, MetricWindowStore store) {
        this.ingestionService = ingestionService;
        this.store = store;
    }

    @Operation(summary = "Ingest a metric sample",
            description = "Scores the sample against the metric's prior history with every detection strategy, " +
                    "then appends it to the metric window. Rejected with 400 for an empty name, a non-finite value, " +
                    "or a timestamp that is not after the metric's last sample.")
    @PostMapping
    public ResponseEntity<IngestionResult> ingest(@RequestBody MetricSampleRequest request) {
        return ResponseEntity.ok(ingestionService.ingest(request));
    }

    @Operation(summary = "Ingest a batch of samples",
            description = "Samples are ingested in order. A rejected sample is reported in its result and does not stop the batch.")
    @PostMapping("/batch")
    public ResponseEntity<List<IngestionResult>> ingestBatch(@RequestBody List<MetricSampleRequest> requests) {
        return ResponseEntity.ok(ingestionService.ingestBatch(requests));
    }

    @Operation(summary = "List tracked metrics")
    @GetMapping
    public ResponseEntity<Set<String>> listMetrics() {
        return ResponseEntity.ok(store.metricNames());
    }

    @Operation(summary = "Windowed aggregate",
            description = "Aggregate over samples in the trailing window. 'noData' is true when the window is empty.")
    @GetMapping("/{metricName}/aggregate")
    public ResponseEntity<AggregateResponse> aggregate(
            @Parameter(description = "Metric name", example = "error_rate")
            @PathVariable String metricName,
            @Parameter(description = "Trailing window in minutes", example = "5")
            @RequestParam(defaultValue = "5") int windowMinutes,
            @Parameter(description = "avg, sum, min, max or count", example = "avg")
            @RequestParam(defaultValue = "avg") String aggregation) {
        Aggregation agg = Aggregation.fromValue(aggregation);
        return ResponseEntity.ok(AggregateResponse.of(metricName, windowMinutes, agg,
                store.aggregate(metricName, windowMinutes, agg)));
    }

    @Operation(summary = "Most recent samples", description = "Up to 'count' samples, oldest first.")
    @GetMapping("/{metricName}/recent")
    public ResponseEntity<List<MetricSample>> recent(
            @Parameter(description = "Metric name", example = "response_time")
            @PathVariable String metricName,
            @Parameter(description = "Maximum samples returned", example = "100")
            @RequestParam(defaultValue = "100") int count) {
        return ResponseEntity.ok(store.recent(metricName, count));
    }

    @Operation(summary = "Score a value without storing it",
            description = "Diagnostic: evaluates the value at the current time against the metric's history.")
    @PostMapping("/{metricName}/verdict")
    public ResponseEntity<AnomalyVerdict> verdict(
            @Parameter(description = "Metric name", example = "response_time")
            @PathVariable String metricName,
            @RequestBody MetricSampleRequest request) {
        if (request.getValue() == null) {
            throw new IllegalArgumentException("'value' is required");
        }
        return ResponseEntity.ok(ingestionService.getVerdict(metricName, request.getValue(), request.getContext()));
    }
}
