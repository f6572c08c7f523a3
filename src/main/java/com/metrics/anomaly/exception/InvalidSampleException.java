package com.metrics.anomaly.exception;

/**
 * Malformed ingestion input: empty metric name, non-finite value, or a timestamp that
 * does not advance past the last sample of the same metric.
 */
public class InvalidSampleException extends RuntimeException {

    private final String metricName;

    public InvalidSampleException(String metricName, String message) {
        super(message);
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
