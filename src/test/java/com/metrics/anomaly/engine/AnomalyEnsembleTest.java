package com.metrics.anomaly.engine;

import com.metrics.anomaly.config.AlertingConfig;
import com.metrics.anomaly.config.DetectionConfig;
import com.metrics.anomaly.engine.detection.DetectionStrategy;
import com.metrics.anomaly.engine.detection.StatisticalStrategy;
import com.metrics.anomaly.engine.fusion.OrMaxFusion;
import com.metrics.anomaly.model.AnomalyVerdict;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.StrategyVerdict;
import com.metrics.anomaly.store.MetricWindowStore;
import com.metrics.anomaly.testutil.MutableClock;
import com.metrics.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import com.metrics.anomaly.config.MetricsConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.metrics.anomaly.testutil.TestDataFactory.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyEnsembleTest {

    private static final MetricSample SAMPLE = MetricSample.of("cpu", BASE_TIME, 42.0);

    private static DetectionStrategy fixed(String name, boolean anomaly, double confidence) {
        return new DetectionStrategy() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public StrategyVerdict evaluate(MetricSample sample) {
                return StrategyVerdict.of(anomaly, confidence, "fixed");
            }
        };
    }

    private static DetectionStrategy failing(String name) {
        return new DetectionStrategy() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public StrategyVerdict evaluate(MetricSample sample) {
                throw new IllegalStateException("boom");
            }
        };
    }

    private static AnomalyEnsemble ensemble(DetectionStrategy... strategies) {
        return new AnomalyEnsemble(List.of(strategies), new OrMaxFusion(),
                TestDataFactory.metricsConfig(), new MutableClock(BASE_TIME));
    }

    @Test
    void evaluate_anyStrategyFlags_isAnomalyWithMaxConfidence() {
        AnomalyVerdict verdict = ensemble(
                fixed("a", true, 0.6),
                fixed("b", false, 0.9),
                fixed("c", false, 0.0)).evaluate(SAMPLE);

        assertThat(verdict.isAnomaly()).isTrue();
        assertThat(verdict.getConfidence()).isEqualTo(0.9);
        assertThat(verdict.getFlaggedBy()).containsExactly("a");
        assertThat(verdict.getPerStrategy()).containsOnlyKeys("a", "b", "c");
        assertThat(verdict.getEvaluatedAt()).isEqualTo(BASE_TIME);
    }

    @Test
    void evaluate_noStrategyFlags_notAnomaly() {
        AnomalyVerdict verdict = ensemble(fixed("a", false, 0.3), fixed("b", false, 0.1)).evaluate(SAMPLE);

        assertThat(verdict.isAnomaly()).isFalse();
        assertThat(verdict.getConfidence()).isEqualTo(0.3);
        assertThat(verdict.getFlaggedBy()).isEmpty();
    }

    @Test
    void evaluate_confidenceAlwaysWithinUnitInterval() {
        AnomalyVerdict verdict = ensemble(
                fixed("a", true, 7.5),
                fixed("b", false, -2.0),
                fixed("c", false, Double.NaN)).evaluate(SAMPLE);

        assertThat(verdict.getConfidence()).isBetween(0.0, 1.0);
        verdict.getPerStrategy().values().forEach(c -> assertThat(c).isBetween(0.0, 1.0));
    }

    @Test
    void evaluate_failingStrategy_isolatedAsAbstention() {
        MetricsConfig metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        AnomalyEnsemble ensemble = new AnomalyEnsemble(
                List.of(failing("broken"), fixed("ok", true, 0.8)),
                new OrMaxFusion(), metricsConfig, new MutableClock(BASE_TIME));

        AnomalyVerdict verdict = ensemble.evaluate(SAMPLE);

        assertThat(verdict.isAnomaly()).isTrue();
        assertThat(verdict.getPerStrategy()).containsEntry("broken", 0.0).containsEntry("ok", 0.8);
        assertThat(verdict.getFlaggedBy()).containsExactly("ok");
    }

    @Test
    void constructor_duplicateStrategyNames_rejected() {
        assertThatThrownBy(() -> ensemble(fixed("dup", false, 0), fixed("dup", false, 0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("dup");
    }

    @Test
    void evaluate_realStatisticalStrategy_flagsSpike() {
        MetricWindowStore store = new MetricWindowStore(new AlertingConfig(), new MutableClock(BASE_TIME));
        for (int i = 0; i < 40; i++) {
            store.ingest("response_time", i % 2 == 0 ? 180.0 : 220.0, BASE_TIME + i * 1000L, Map.of());
        }
        AnomalyEnsemble ensemble = ensemble(new StatisticalStrategy(store, new DetectionConfig()));

        AnomalyVerdict verdict = ensemble.evaluate(MetricSample.of("response_time", BASE_TIME + 60_000, 500.0));

        assertThat(verdict.isAnomaly()).isTrue();
        assertThat(verdict.getConfidence()).isEqualTo(1.0);
        assertThat(verdict.getFlaggedBy()).containsExactly(StatisticalStrategy.NAME);
        assertThat(ensemble.strategyNames()).containsExactly(StatisticalStrategy.NAME);
    }
}
