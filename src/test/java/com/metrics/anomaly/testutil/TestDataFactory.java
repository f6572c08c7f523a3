package com.metrics.anomaly.testutil;

import com.metrics.anomaly.config.AlertingConfig;
import com.metrics.anomaly.config.MetricsConfig;
import com.metrics.anomaly.model.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    // 2025-02-18T12:00:00Z
    public static final long BASE_TIME = 1739880000000L;

    private TestDataFactory() {}

    public static MetricsConfig metricsConfig() {
        return new MetricsConfig(new SimpleMeterRegistry());
    }

    public static AlertingConfig alertingConfig() {
        return new AlertingConfig();
    }

    public static MetricSample sample(String metric, long timestamp, double value) {
        return MetricSample.of(metric, timestamp, value);
    }

    public static MetricSampleRequest sampleRequest(String metric, long timestamp, double value) {
        return MetricSampleRequest.builder()
                .metricName(metric)
                .timestamp(timestamp)
                .value(value)
                .build();
    }

    public static ChannelConfig webhook(String url) {
        return ChannelConfig.of(ChannelType.WEBHOOK, Map.of("url", url));
    }

    public static ChannelConfig slack(String url) {
        return ChannelConfig.of(ChannelType.SLACK, Map.of("webhookUrl", url));
    }

    public static AlertRule createRule(String id, String metric, ComparisonOperator operator, double threshold,
                                       int windowMinutes, Aggregation aggregation) {
        return AlertRule.builder()
                .id(id)
                .name("Test rule " + id)
                .description("Test rule on " + metric)
                .condition(AlertCondition.builder()
                        .metric(metric)
                        .operator(operator)
                        .threshold(threshold)
                        .windowMinutes(windowMinutes)
                        .aggregation(aggregation)
                        .build())
                .severity(Severity.HIGH)
                .channels(new ArrayList<>(List.of(webhook("http://hooks.test/" + id))))
                .build();
    }

    public static AlertRule createErrorRateRule(String id) {
        return createRule(id, "error_rate", ComparisonOperator.GT, 0.05, 5, Aggregation.AVG);
    }

    public static Alert createAlert(String id, String ruleId) {
        return Alert.builder()
                .id(id)
                .ruleId(ruleId)
                .ruleName("Test rule " + ruleId)
                .severity(Severity.HIGH)
                .message("[HIGH] Test rule " + ruleId + ": avg(error_rate) over 5m = 0.0800 > 0.0500")
                .timestamp(BASE_TIME)
                .metric("error_rate")
                .aggregateValue(0.08)
                .values(List.of(0.07, 0.08, 0.09))
                .correlationId("corr-" + id)
                .build();
    }

    public static AnomalyVerdict createVerdict(boolean anomaly, double confidence, String... flaggedBy) {
        return AnomalyVerdict.builder()
                .anomaly(anomaly)
                .confidence(confidence)
                .perStrategy(Map.of("statistical", confidence))
                .flaggedBy(List.of(flaggedBy))
                .evaluatedAt(BASE_TIME)
                .build();
    }
}
