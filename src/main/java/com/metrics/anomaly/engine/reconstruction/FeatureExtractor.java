package com.metrics.anomaly.engine.reconstruction;

import com.metrics.anomaly.model.MetricSample;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the feature vector the reconstruction model learns from.
 *
 * Features:
 *   [0] Value
 *   [1] Hour-of-day: hour (0-23) / 24.0
 *   [2] Day-of-week: (ISO day - 1) / 7.0, Monday = 0.0
 *   [3..] Configured context signals, parsed as numbers (missing or non-numeric = 0.0)
 */
public class FeatureExtractor {

    public static final int BASE_FEATURE_COUNT = 3;

    private final ZoneId zone;
    private final List<String> contextSignals;

    public FeatureExtractor(ZoneId zone, List<String> contextSignals) {
        this.zone = zone;
        this.contextSignals = List.copyOf(contextSignals);
    }

    public int featureCount() {
        return BASE_FEATURE_COUNT + contextSignals.size();
    }

    public List<String> featureNames() {
        List<String> names = new ArrayList<>(List.of("Value", "Hour-of-Day", "Day-of-Week"));
        for (String signal : contextSignals) {
            names.add("Context:" + signal);
        }
        return names;
    }

    public double[] extract(MetricSample sample) {
        double[] features = new double[featureCount()];

        features[0] = sample.getValue();

        ZonedDateTime time = ZonedDateTime.ofInstant(
                java.time.Instant.ofEpochMilli(sample.getTimestamp()), zone);
        features[1] = time.getHour() / 24.0;
        features[2] = (time.getDayOfWeek().getValue() - 1) / 7.0;

        for (int i = 0; i < contextSignals.size(); i++) {
            features[BASE_FEATURE_COUNT + i] = parseSignal(sample.getContext().get(contextSignals.get(i)));
        }

        return features;
    }

    private static double parseSignal(String raw) {
        if (raw == null) return 0.0;
        try {
            double parsed = Double.parseDouble(raw.trim());
            return Double.isFinite(parsed) ? parsed : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
