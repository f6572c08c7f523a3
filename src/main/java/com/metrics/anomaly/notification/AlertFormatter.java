package com.metrics.anomaly.notification;

import com.metrics.anomaly.model.Alert;

import java.time.Instant;

/**
 * Plain-text rendering shared by the text-based channels.
 */
public final class AlertFormatter {

    private AlertFormatter() {
    }

    public static String subject(Alert alert) {
        return String.format("[%s] %s", alert.getSeverity().name(),
                alert.getRuleName() != null ? alert.getRuleName() : alert.getRuleId());
    }

    public static String body(Alert alert) {
        return String.format(
                "%s\n" +
                "Rule: %s\n" +
                "Metric: %s\n" +
                "Value: %.4f\n" +
                "Time: %s\n" +
                "Alert ID: %s\n" +
                "Correlation ID: %s",
                alert.getMessage(),
                alert.getRuleId(),
                alert.getMetric(),
                alert.getAggregateValue(),
                Instant.ofEpochMilli(alert.getTimestamp()),
                alert.getId(),
                alert.getCorrelationId()
        );
    }
}
