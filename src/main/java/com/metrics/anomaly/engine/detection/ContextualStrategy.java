package com.metrics.anomaly.engine.detection;

import com.metrics.anomaly.config.DetectionConfig;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.StrategyVerdict;
import com.metrics.anomaly.store.MetricWindowStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Compares the value only against historical samples taken in the same hour of day.
 * When match keys are configured, a historical sample must also carry the same value for each
 * match key the evaluated sample carries (e.g. the same region).
 */
@Component
public class ContextualStrategy implements DetectionStrategy {

    public static final String NAME = "contextual";

    private final MetricWindowStore store;
    private final DetectionConfig.Contextual config;
    private final ZoneId zone;

    public ContextualStrategy(MetricWindowStore store, DetectionConfig detectionConfig) {
        this.store = store;
        this.config = detectionConfig.getContextual();
        this.zone = detectionConfig.zoneId();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public StrategyVerdict evaluate(MetricSample sample) {
        int hour = hourOfDay(sample.getTimestamp());
        List<MetricSample> similar = store.recent(sample.getMetricName(), config.getHistorySize()).stream()
                .filter(h -> hourOfDay(h.getTimestamp()) == hour)
                .filter(h -> sameContext(sample, h))
                .toList();

        if (similar.size() < config.getMinSimilarSamples()) {
            return StrategyVerdict.abstain(String.format(
                    "Insufficient similar history for hour %02d: %d of %d samples",
                    hour, similar.size(), config.getMinSimilarSamples()));
        }

        double mean = SampleStatistics.mean(similar);
        double stdDev = SampleStatistics.stdDev(similar, mean);
        double z = SampleStatistics.zScore(sample.getValue(), mean, stdDev);
        double threshold = config.getZScoreThreshold();

        return StrategyVerdict.of(z > threshold, Math.min(z / threshold, 1.0), String.format(
                "hour=%02d similar=%d mean=%.4f stddev=%.4f z=%.2f (threshold=%.1f)",
                hour, similar.size(), mean, stdDev, z, threshold));
    }

    private int hourOfDay(long timestamp) {
        return Instant.ofEpochMilli(timestamp).atZone(zone).getHour();
    }

    private boolean sameContext(MetricSample sample, MetricSample historical) {
        for (String key : config.getMatchKeys()) {
            String expected = sample.getContext().get(key);
            if (expected != null && !Objects.equals(expected, historical.getContext().get(key))) {
                return false;
            }
        }
        return true;
    }
}
