package com.metrics.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;
import java.util.OptionalDouble;

public enum Aggregation {
    AVG,
    SUM,
    MIN,
    MAX,
    COUNT;

    /**
     * Aggregates the given samples. An empty collection yields an empty result ("no data"),
     * including for {@link #COUNT}.
     */
    public OptionalDouble apply(Collection<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return OptionalDouble.empty();
        }
        return switch (this) {
            case AVG -> samples.stream().mapToDouble(MetricSample::getValue).average();
            case SUM -> OptionalDouble.of(samples.stream().mapToDouble(MetricSample::getValue).sum());
            case MIN -> samples.stream().mapToDouble(MetricSample::getValue).min();
            case MAX -> samples.stream().mapToDouble(MetricSample::getValue).max();
            case COUNT -> OptionalDouble.of(samples.size());
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Aggregation fromValue(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown aggregation: '" + value
                    + "'. Supported: avg, sum, min, max, count");
        }
    }
}
