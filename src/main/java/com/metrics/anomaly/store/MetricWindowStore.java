package com.metrics.anomaly.store;

import com.metrics.anomaly.config.AlertingConfig;
import com.metrics.anomaly.exception.InvalidSampleException;
import com.metrics.anomaly.model.Aggregation;
import com.metrics.anomaly.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory per-metric sample history.
 *
 * Windows are created lazily on the first sample of a metric and live for the lifetime of the
 * process. Each window carries its own lock, so ingestion for one metric never waits on another.
 */
@Component
public class MetricWindowStore {

    private static final Logger log = LoggerFactory.getLogger(MetricWindowStore.class);

    private final Map<String, MetricWindow> windows = new ConcurrentHashMap<>();
    private final AlertingConfig.Window windowConfig;
    private final Clock clock;

    public MetricWindowStore(AlertingConfig alertingConfig, Clock clock) {
        this.windowConfig = alertingConfig.getWindow();
        this.clock = clock;
    }

    public MetricSample ingest(String metricName, double value, long timestampMs, Map<String, String> context) {
        validate(metricName, value);
        validateContext(metricName, context);
        MetricSample sample = MetricSample.of(metricName, timestampMs, value, context);
        ingest(sample);
        return sample;
    }

    public void ingest(MetricSample sample) {
        validate(sample.getMetricName(), sample.getValue());
        MetricWindow window = windows.computeIfAbsent(sample.getMetricName(), name -> {
            log.debug("Creating window for metric {} (maxSamples={}, maxAgeMinutes={})",
                    name, windowConfig.getMaxSamples(), windowConfig.getMaxAgeMinutes());
            return new MetricWindow(name, windowConfig.getMaxSamples(), windowConfig.maxAgeMs());
        });
        window.append(sample);
    }

    /**
     * Checks that do not depend on stored history. Timestamp ordering is enforced on append.
     */
    public static void validate(String metricName, double value) {
        if (metricName == null || metricName.isBlank()) {
            throw new InvalidSampleException(metricName, "Metric name must not be empty");
        }
        if (!Double.isFinite(value)) {
            throw new InvalidSampleException(metricName,
                    "Value for metric '" + metricName + "' must be finite, got: " + value);
        }
    }

    /**
     * Context tags are optional, but a present map may not hold null keys or values.
     */
    public static void validateContext(String metricName, Map<String, String> context) {
        if (context == null) {
            return;
        }
        for (Map.Entry<String, String> entry : context.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new InvalidSampleException(metricName, "Context for metric '" + metricName
                        + "' has a null key or value: " + entry.getKey() + "=" + entry.getValue());
            }
        }
    }

    public OptionalDouble aggregate(String metricName, int windowMinutes, Aggregation aggregation) {
        return aggregate(metricName, windowMinutes, aggregation, clock.millis());
    }

    /**
     * Aggregate over samples with {@code timestamp >= now - windowMinutes}. Empty when the
     * range holds no samples, so "no data" is never confused with a literal zero.
     */
    public OptionalDouble aggregate(String metricName, int windowMinutes, Aggregation aggregation, long now) {
        return aggregation.apply(window(metricName, windowMinutes, now));
    }

    public List<MetricSample> window(String metricName, int windowMinutes, long now) {
        if (windowMinutes <= 0) {
            throw new IllegalArgumentException("windowMinutes must be > 0, got: " + windowMinutes);
        }
        MetricWindow window = windows.get(metricName);
        if (window == null) {
            return Collections.emptyList();
        }
        return window.since(now - windowMinutes * 60_000L);
    }

    public List<MetricSample> recent(String metricName, int count) {
        MetricWindow window = windows.get(metricName);
        if (window == null) {
            return Collections.emptyList();
        }
        return window.recent(count);
    }

    public int size(String metricName) {
        MetricWindow window = windows.get(metricName);
        return window == null ? 0 : window.size();
    }

    public int metricCount() {
        return windows.size();
    }

    public Set<String> metricNames() {
        return Collections.unmodifiableSet(new TreeSet<>(windows.keySet()));
    }
}
