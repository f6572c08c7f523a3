package com.metrics.anomaly.engine.detection;

import com.metrics.anomaly.config.DetectionConfig;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.StrategyVerdict;
import com.metrics.anomaly.store.MetricWindowStore;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Global z-score of the value against the metric's recent history.
 *
 * Example: 40 samples with mean 200 and standard deviation 20. A value of 500 has
 * z = (500 - 200) / 20 = 15, which exceeds 3, so it is flagged with confidence min(15/3, 1) = 1.
 */
@Component
public class StatisticalStrategy implements DetectionStrategy {

    public static final String NAME = "statistical";

    private final MetricWindowStore store;
    private final DetectionConfig.Statistical config;

    public StatisticalStrategy(MetricWindowStore store, DetectionConfig detectionConfig) {
        this.store = store;
        this.config = detectionConfig.getStatistical();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public StrategyVerdict evaluate(MetricSample sample) {
        List<MetricSample> history = store.recent(sample.getMetricName(), config.getHistorySize());
        if (history.size() < config.getMinSamples()) {
            return StrategyVerdict.abstain(String.format(
                    "Insufficient history: %d of %d samples", history.size(), config.getMinSamples()));
        }

        double mean = SampleStatistics.mean(history);
        double stdDev = SampleStatistics.stdDev(history, mean);
        double z = SampleStatistics.zScore(sample.getValue(), mean, stdDev);
        double threshold = config.getZScoreThreshold();

        return StrategyVerdict.of(z > threshold, Math.min(z / threshold, 1.0), String.format(
                "value=%.4f mean=%.4f stddev=%.4f z=%.2f (threshold=%.1f)",
                sample.getValue(), mean, stdDev, z, threshold));
    }
}
