package com.metrics.anomaly.engine.detection;

import com.metrics.anomaly.config.AlertingConfig;
import com.metrics.anomaly.config.DetectionConfig;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.StrategyVerdict;
import com.metrics.anomaly.store.MetricWindowStore;
import com.metrics.anomaly.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.metrics.anomaly.testutil.TestDataFactory.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;

class ContextualStrategyTest {

    private static final long HOUR = 3_600_000L;
    private static final long DAY = 24 * HOUR;
    // BASE_TIME is 12:00 UTC; start ten days earlier at midnight
    private static final long MIDNIGHT = BASE_TIME - 12 * HOUR - 10 * DAY;

    private MetricWindowStore store;
    private DetectionConfig detectionConfig;

    @BeforeEach
    void setUp() {
        store = new MetricWindowStore(new AlertingConfig(), new MutableClock(BASE_TIME));
        detectionConfig = new DetectionConfig();
    }

    @Test
    void evaluate_valueNormalAtNightButNotAtNoon_flaggedAtNoon() {
        // Nightly batch: ~10 at 03:00; daytime traffic: 95/105 at 12:00
        for (int d = 0; d < 10; d++) {
            store.ingest("traffic", 10.0, MIDNIGHT + d * DAY + 3 * HOUR, Map.of());
            store.ingest("traffic", d % 2 == 0 ? 95.0 : 105.0, MIDNIGHT + d * DAY + 12 * HOUR, Map.of());
        }
        ContextualStrategy strategy = new ContextualStrategy(store, detectionConfig);
        long noon = MIDNIGHT + 10 * DAY + 12 * HOUR + 60_000;

        StrategyVerdict lowAtNoon = strategy.evaluate(MetricSample.of("traffic", noon, 10.0));
        StrategyVerdict normalAtNoon = strategy.evaluate(MetricSample.of("traffic", noon, 101.0));

        assertThat(lowAtNoon.isAnomaly()).isTrue();
        assertThat(lowAtNoon.getConfidence()).isEqualTo(1.0);
        assertThat(lowAtNoon.getReason()).contains("hour=12");
        assertThat(normalAtNoon.isAnomaly()).isFalse();
    }

    @Test
    void evaluate_tooFewSimilarSamples_abstains() {
        for (int d = 0; d < 4; d++) {
            store.ingest("traffic", 100.0, MIDNIGHT + d * DAY + 12 * HOUR, Map.of());
        }
        for (int i = 0; i < 50; i++) {
            store.ingest("traffic", 100.0, MIDNIGHT + 5 * DAY + i * 60_000L, Map.of());
        }
        ContextualStrategy strategy = new ContextualStrategy(store, detectionConfig);

        StrategyVerdict verdict = strategy.evaluate(
                MetricSample.of("traffic", MIDNIGHT + 10 * DAY + 12 * HOUR, 9999.0));

        assertThat(verdict.isAnomaly()).isFalse();
        assertThat(verdict.getConfidence()).isZero();
        assertThat(verdict.getReason()).contains("Insufficient similar history");
    }

    @Test
    void evaluate_matchKeys_compareOnlyWithinSameContext() {
        for (int d = 0; d < 10; d++) {
            long noon = MIDNIGHT + d * DAY + 12 * HOUR;
            store.ingest("latency", d % 2 == 0 ? 95.0 : 105.0, noon, Map.of("region", "eu"));
            store.ingest("latency", d % 2 == 0 ? 490.0 : 510.0, noon + 60_000, Map.of("region", "us"));
        }
        long evalTime = MIDNIGHT + 10 * DAY + 12 * HOUR + 120_000;
        MetricSample euSpike = MetricSample.of("latency", evalTime, 500.0, Map.of("region", "eu"));

        StrategyVerdict pooled = new ContextualStrategy(store, detectionConfig).evaluate(euSpike);

        detectionConfig.getContextual().setMatchKeys(List.of("region"));
        StrategyVerdict byRegion = new ContextualStrategy(store, detectionConfig).evaluate(euSpike);

        assertThat(pooled.isAnomaly()).isFalse();
        assertThat(byRegion.isAnomaly()).isTrue();
    }
}
