package com.metrics.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger pendingEscalations;
    private final AtomicInteger trackedMetrics;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.pendingEscalations = registry.gauge("escalation.pending", new AtomicInteger(0));
        this.trackedMetrics = registry.gauge("metric.windows.tracked", new AtomicInteger(0));
    }

    public void recordSampleIngested(boolean anomaly) {
        Counter.builder("sample.ingested.count")
                .tag("anomaly", String.valueOf(anomaly))
                .register(registry)
                .increment();
    }

    public void recordSampleRejected() {
        Counter.builder("sample.rejected.count")
                .register(registry)
                .increment();
    }

    public void recordStrategyFlagged(String strategy) {
        Counter.builder("detection.flagged.count")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public void recordStrategyFailure(String strategy) {
        Counter.builder("detection.failure.count")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public void recordTrainingFailure() {
        Counter.builder("model.training.failure.count")
                .register(registry)
                .increment();
    }

    public void recordRuleFired(String severity) {
        Counter.builder("rule.fired.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordRuleEvaluationFailure() {
        Counter.builder("rule.evaluation.failure.count")
                .register(registry)
                .increment();
    }

    public void recordAlertSuppressed(String severity) {
        Counter.builder("alert.suppressed.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordEscalation(String outcome) {
        Counter.builder("escalation.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void updatePendingEscalations(int count) {
        pendingEscalations.set(count);
    }

    public void updateTrackedMetrics(int count) {
        trackedMetrics.set(count);
    }
}
