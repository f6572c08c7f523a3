package com.metrics.anomaly.controller;

import com.metrics.anomaly.service.ReconstructionModelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Reconstruction model training and metadata")
public class ModelController {

    private final ReconstructionModelService modelService;

    public ModelController(ReconstructionModelService modelService) {
        this.modelService = modelService;
    }

    @Operation(summary = "Train the reconstruction model for a metric",
            description = "Retrains immediately from the metric's buffered normal observations. " +
                    "Models are also retrained automatically as new normal samples arrive.")
    @PostMapping("/{metricName}/train")
    public ResponseEntity<Map<String, Object>> train(
            @Parameter(description = "Metric name", example = "response_time")
            @PathVariable String metricName) {
        if (!modelService.trainNow(metricName)) {
            return ResponseEntity.unprocessableEntity()
                    .body(Map.of("error", "Training failed or insufficient history for " + metricName));
        }
        return ResponseEntity.ok(modelService.getModelMetadata(metricName));
    }

    @Operation(summary = "Get model metadata",
            description = "Returns the trained model's sample count, features, neighbours, threshold and training time.")
    @GetMapping("/{metricName}")
    public ResponseEntity<Map<String, Object>> getModelMetadata(
            @Parameter(description = "Metric name", example = "response_time")
            @PathVariable String metricName) {
        Map<String, Object> metadata = modelService.getModelMetadata(metricName);
        if (metadata == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(metadata);
    }
}
