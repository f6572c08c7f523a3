package com.metrics.anomaly.engine.fusion;

import com.metrics.anomaly.model.StrategyVerdict;

import java.util.Map;

/**
 * Combines per-strategy verdicts into the ensemble decision.
 */
public interface VerdictFusion {

    /**
     * @param verdicts strategy name to verdict, in registration order
     */
    boolean isAnomaly(Map<String, StrategyVerdict> verdicts);

    /**
     * @return combined confidence in [0, 1]
     */
    double confidence(Map<String, StrategyVerdict> verdicts);
}
