package com.metrics.anomaly.engine.detection;

import com.metrics.anomaly.config.DetectionConfig;
import com.metrics.anomaly.engine.reconstruction.ReconstructionModel;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.StrategyVerdict;
import com.metrics.anomaly.service.ReconstructionModelService;
import org.springframework.stereotype.Component;

/**
 * Flags samples the learned model of normal behaviour reconstructs poorly.
 * Abstains until a model has been trained for the metric.
 */
@Component
public class ReconstructionStrategy implements DetectionStrategy {

    public static final String NAME = "reconstruction";

    private final ReconstructionModelService modelService;
    private final DetectionConfig.Reconstruction config;

    public ReconstructionStrategy(ReconstructionModelService modelService, DetectionConfig detectionConfig) {
        this.modelService = modelService;
        this.config = detectionConfig.getReconstruction();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public StrategyVerdict evaluate(MetricSample sample) {
        if (!config.isEnabled()) {
            return StrategyVerdict.abstain("Reconstruction detection disabled");
        }
        ReconstructionModel model = modelService.model(sample.getMetricName());
        if (model == null) {
            return StrategyVerdict.abstain("No trained model for metric " + sample.getMetricName());
        }

        double[] features = modelService.getFeatureExtractor().extract(sample);
        if (features.length != model.getFeatureCount()) {
            return StrategyVerdict.abstain(String.format("Model expects %d features, sample has %d",
                    model.getFeatureCount(), features.length));
        }

        double error = model.reconstructionError(features);
        double threshold = model.getThreshold();
        return StrategyVerdict.of(error > threshold, Math.min(error / threshold, 1.0), String.format(
                "reconstruction error=%.4f (threshold=%.4f)", error, threshold));
    }
}
