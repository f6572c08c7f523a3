package com.metrics.anomaly.engine.detection;

import com.metrics.anomaly.config.DetectionConfig;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.StrategyVerdict;
import com.metrics.anomaly.store.MetricWindowStore;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Forecasts the next value with simple exponential smoothing over recent samples and flags
 * values whose forecast error exceeds a multiple of recent volatility.
 *
 * level(0) = x(0); level(t) = alpha * x(t) + (1 - alpha) * level(t-1). The final level is the
 * prediction for the evaluated sample.
 */
@Component
public class TimeSeriesStrategy implements DetectionStrategy {

    public static final String NAME = "time-series";

    private final MetricWindowStore store;
    private final DetectionConfig.TimeSeries config;

    public TimeSeriesStrategy(MetricWindowStore store, DetectionConfig detectionConfig) {
        this.store = store;
        this.config = detectionConfig.getTimeSeries();
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

        double predicted = forecast(history, config.getAlpha());
        double mean = SampleStatistics.mean(history);
        double volatility = SampleStatistics.stdDev(history, mean);
        double allowed = config.getDeviationMultiplier() * volatility;
        double error = Math.abs(sample.getValue() - predicted);

        boolean anomaly;
        double confidence;
        if (allowed == 0) {
            anomaly = error > 0;
            confidence = anomaly ? 1.0 : 0.0;
        } else {
            anomaly = error > allowed;
            confidence = Math.min(error / allowed, 1.0);
        }

        return StrategyVerdict.of(anomaly, confidence, String.format(
                "actual=%.4f predicted=%.4f error=%.4f allowed=%.4f (%.1f x stddev %.4f)",
                sample.getValue(), predicted, error, allowed, config.getDeviationMultiplier(), volatility));
    }

    static double forecast(List<MetricSample> history, double alpha) {
        double level = history.get(0).getValue();
        for (int i = 1; i < history.size(); i++) {
            level = alpha * history.get(i).getValue() + (1 - alpha) * level;
        }
        return level;
    }
}
