package com.metrics.anomaly.engine.detection;

import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.StrategyVerdict;

/**
 * A single anomaly detection strategy. Implementations are discovered as Spring beans and
 * registered into the {@link AnomalyEnsemble}; adding a strategy needs no change to the fusion.
 *
 * Strategies read prior history from the metric store and must not include the evaluated
 * sample itself. When history is insufficient they abstain ({@code anomaly=false, confidence=0}).
 */
public interface DetectionStrategy {

    /**
     * Stable name used as the key in per-strategy verdict maps.
     */
    String getName();

    /**
     * Score one sample against the metric's history.
     *
     * @param sample the sample under evaluation
     * @return this strategy's verdict
     */
    StrategyVerdict evaluate(MetricSample sample);
}
