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
import static org.assertj.core.api.Assertions.within;

class TimeSeriesStrategyTest {

    private MetricWindowStore store;
    private TimeSeriesStrategy strategy;

    @BeforeEach
    void setUp() {
        store = new MetricWindowStore(new AlertingConfig(), new MutableClock(BASE_TIME));
        strategy = new TimeSeriesStrategy(store, new DetectionConfig());
    }

    @Test
    void forecast_exponentialSmoothing() {
        List<MetricSample> history = List.of(
                MetricSample.of("m", 1, 10.0),
                MetricSample.of("m", 2, 20.0),
                MetricSample.of("m", 3, 20.0));

        // level: 10 -> 0.5*20 + 0.5*10 = 15 -> 0.5*20 + 0.5*15 = 17.5
        assertThat(TimeSeriesStrategy.forecast(history, 0.5)).isCloseTo(17.5, within(1e-9));
    }

    @Test
    void evaluate_belowMinimumHistory_abstains() {
        for (int i = 0; i < 9; i++) {
            store.ingest("rps", 100.0, BASE_TIME + i * 1000L, Map.of());
        }

        StrategyVerdict verdict = strategy.evaluate(MetricSample.of("rps", BASE_TIME + 60_000, 5000.0));

        assertThat(verdict.isAnomaly()).isFalse();
        assertThat(verdict.getConfidence()).isZero();
    }

    @Test
    void evaluate_valueNearForecast_notFlagged() {
        for (int i = 0; i < 50; i++) {
            store.ingest("rps", i % 2 == 0 ? 99.0 : 101.0, BASE_TIME + i * 1000L, Map.of());
        }

        StrategyVerdict verdict = strategy.evaluate(MetricSample.of("rps", BASE_TIME + 60_000, 100.5));

        assertThat(verdict.isAnomaly()).isFalse();
        assertThat(verdict.getConfidence()).isLessThan(1.0);
    }

    @Test
    void evaluate_spikeFarFromForecast_flagged() {
        for (int i = 0; i < 50; i++) {
            store.ingest("rps", i % 2 == 0 ? 99.0 : 101.0, BASE_TIME + i * 1000L, Map.of());
        }

        StrategyVerdict verdict = strategy.evaluate(MetricSample.of("rps", BASE_TIME + 60_000, 120.0));

        assertThat(verdict.isAnomaly()).isTrue();
        assertThat(verdict.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void evaluate_steadyTrend_followsLevel() {
        // Slowly rising series; the smoothed level lags slightly but stays well inside 3 stddev
        for (int i = 0; i < 100; i++) {
            store.ingest("disk_used", 1000.0 + i, BASE_TIME + i * 1000L, Map.of());
        }

        StrategyVerdict verdict = strategy.evaluate(MetricSample.of("disk_used", BASE_TIME + 200_000, 1100.0));

        assertThat(verdict.isAnomaly()).isFalse();
    }

    @Test
    void evaluate_constantSeries_anyChangeFlagged() {
        for (int i = 0; i < 20; i++) {
            store.ingest("replicas", 3.0, BASE_TIME + i * 1000L, Map.of());
        }

        assertThat(strategy.evaluate(MetricSample.of("replicas", BASE_TIME + 60_000, 3.0)).isAnomaly()).isFalse();
        assertThat(strategy.evaluate(MetricSample.of("replicas", BASE_TIME + 60_000, 4.0)).isAnomaly()).isTrue();
    }
}
