package com.metrics.anomaly.engine.detection;

import com.metrics.anomaly.model.MetricSample;

import java.util.List;

final class SampleStatistics {

    private SampleStatistics() {
    }

    static double mean(List<MetricSample> samples) {
        double sum = 0;
        for (MetricSample s : samples) {
            sum += s.getValue();
        }
        return sum / samples.size();
    }

    // Population standard deviation
    static double stdDev(List<MetricSample> samples, double mean) {
        double sumSquaredDiff = 0;
        for (MetricSample s : samples) {
            double diff = s.getValue() - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / samples.size());
    }

    /**
     * Absolute z-score. With zero spread, a value equal to the mean scores 0 and any other
     * value scores positive infinity.
     */
    static double zScore(double value, double mean, double stdDev) {
        double diff = Math.abs(value - mean);
        if (stdDev == 0) {
            return diff == 0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return diff / stdDev;
    }
}
