package com.metrics.anomaly.model;

import lombok.Value;

/**
 * Outcome of a single detection strategy. Confidence is clamped to [0, 1].
 */
@Value
public class StrategyVerdict {

    boolean anomaly;
    double confidence;
    String reason;

    public static StrategyVerdict of(boolean anomaly, double confidence, String reason) {
        double clamped = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        return new StrategyVerdict(anomaly, clamped, reason);
    }

    public static StrategyVerdict abstain(String reason) {
        return new StrategyVerdict(false, 0.0, reason);
    }
}
