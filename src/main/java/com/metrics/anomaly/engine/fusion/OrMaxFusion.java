package com.metrics.anomaly.engine.fusion;

import com.metrics.anomaly.model.StrategyVerdict;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Anomalous if any strategy flags the sample; confidence is the highest reported by any strategy.
 */
@Component
public class OrMaxFusion implements VerdictFusion {

    @Override
    public boolean isAnomaly(Map<String, StrategyVerdict> verdicts) {
        return verdicts.values().stream().anyMatch(StrategyVerdict::isAnomaly);
    }

    @Override
    public double confidence(Map<String, StrategyVerdict> verdicts) {
        return verdicts.values().stream()
                .mapToDouble(StrategyVerdict::getConfidence)
                .max()
                .orElse(0.0);
    }
}
