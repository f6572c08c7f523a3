package com.metrics.anomaly.engine;

import com.metrics.anomaly.config.MetricsConfig;
import com.metrics.anomaly.engine.detection.DetectionStrategy;
import com.metrics.anomaly.engine.fusion.VerdictFusion;
import com.metrics.anomaly.model.AnomalyVerdict;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.StrategyVerdict;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered detection strategy against a sample and fuses the results.
 * Uses the Strategy pattern: each DetectionStrategy bean is auto-registered under its name.
 */
@Component
public class AnomalyEnsemble {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEnsemble.class);

    private final Map<String, DetectionStrategy> strategies = new LinkedHashMap<>();
    private final VerdictFusion fusion;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyEnsemble(List<DetectionStrategy> strategies, VerdictFusion fusion,
                           MetricsConfig metricsConfig, Clock clock) {
        this.fusion = fusion;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        for (DetectionStrategy strategy : strategies) {
            DetectionStrategy previous = this.strategies.putIfAbsent(strategy.getName(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate detection strategy name: " + strategy.getName());
            }
            log.info("Registered detection strategy: {} -> {}",
                    strategy.getName(), strategy.getClass().getSimpleName());
        }
    }

    public List<String> strategyNames() {
        return List.copyOf(strategies.keySet());
    }

    /**
     * Evaluate the sample against the metric's history as it stands (the sample itself must not
     * have been appended yet). A strategy that throws is treated as abstaining.
     */
    @Observed(name = "detection.evaluate", contextualName = "ensemble-evaluate")
    public AnomalyVerdict evaluate(MetricSample sample) {
        Map<String, StrategyVerdict> verdicts = new LinkedHashMap<>();
        for (DetectionStrategy strategy : strategies.values()) {
            StrategyVerdict verdict;
            try {
                verdict = strategy.evaluate(sample);
            } catch (Exception e) {
                log.error("Strategy {} failed for metric {}: {}",
                        strategy.getName(), sample.getMetricName(), e.getMessage(), e);
                metricsConfig.recordStrategyFailure(strategy.getName());
                verdict = StrategyVerdict.abstain("Strategy failed: " + e.getMessage());
            }
            verdicts.put(strategy.getName(), verdict);
        }

        Map<String, Double> perStrategy = new LinkedHashMap<>();
        List<String> flaggedBy = new ArrayList<>();
        verdicts.forEach((name, verdict) -> {
            perStrategy.put(name, verdict.getConfidence());
            if (verdict.isAnomaly()) {
                flaggedBy.add(name);
                metricsConfig.recordStrategyFlagged(name);
            }
        });

        boolean anomaly = fusion.isAnomaly(verdicts);
        double confidence = Math.max(0.0, Math.min(1.0, fusion.confidence(verdicts)));

        if (anomaly) {
            log.debug("Anomaly on {} value={} confidence={} flaggedBy={}",
                    sample.getMetricName(), sample.getValue(), confidence, flaggedBy);
        }

        return AnomalyVerdict.builder()
                .anomaly(anomaly)
                .confidence(confidence)
                .perStrategy(perStrategy)
                .flaggedBy(flaggedBy)
                .evaluatedAt(clock.millis())
                .build();
    }
}
