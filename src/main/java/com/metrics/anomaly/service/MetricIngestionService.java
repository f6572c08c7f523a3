package com.metrics.anomaly.service;

import com.metrics.anomaly.config.DetectionConfig;
import com.metrics.anomaly.config.MetricsConfig;
import com.metrics.anomaly.engine.AnomalyEnsemble;
import com.metrics.anomaly.exception.InvalidSampleException;
import com.metrics.anomaly.model.AnomalyVerdict;
import com.metrics.anomaly.model.IngestionResult;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.model.MetricSampleRequest;
import com.metrics.anomaly.store.MetricWindowStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ingestion pipeline for a single sample:
 *   1. Validate (name, finite value, timestamp after the metric's last sample)
 *   2. Evaluate the ensemble against the history as it stands, so the sample never scores itself
 *   3. Append to the metric window
 *   4. Feed non-anomalous samples to the reconstruction trainer
 *   5. Publish the confidence as '<metric>.anomaly_confidence' so rules can alert on it
 */
@Service
public class MetricIngestionService {

    private static final Logger log = LoggerFactory.getLogger(MetricIngestionService.class);

    public static final String VERDICT_SUFFIX = ".anomaly_confidence";

    private final MetricWindowStore store;
    private final AnomalyEnsemble ensemble;
    private final ReconstructionModelService modelService;
    private final DetectionConfig detectionConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public MetricIngestionService(MetricWindowStore store, AnomalyEnsemble ensemble,
                                  ReconstructionModelService modelService, DetectionConfig detectionConfig,
                                  MetricsConfig metricsConfig, Clock clock) {
        this.store = store;
        this.ensemble = ensemble;
        this.modelService = modelService;
        this.detectionConfig = detectionConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @throws InvalidSampleException if the sample is rejected; nothing is stored in that case
     */
    @Observed(name = "metric.ingest", contextualName = "ingest-sample")
    public IngestionResult ingest(MetricSampleRequest request) {
        MetricSample sample;
        try {
            sample = toSample(request);
            checkOrdering(sample);
        } catch (InvalidSampleException e) {
            metricsConfig.recordSampleRejected();
            log.warn("Rejected sample for metric {}: {}", e.getMetricName(), e.getMessage());
            throw e;
        }

        AnomalyVerdict verdict = ensemble.evaluate(sample);

        try {
            store.ingest(sample);
        } catch (InvalidSampleException e) {
            // A concurrent writer got a later timestamp in first
            metricsConfig.recordSampleRejected();
            log.warn("Rejected sample for metric {}: {}", e.getMetricName(), e.getMessage());
            throw e;
        }
        metricsConfig.updateTrackedMetrics(store.metricCount());

        if (!verdict.isAnomaly()) {
            modelService.learn(sample);
        }
        if (detectionConfig.isPublishVerdicts()) {
            publishVerdict(sample, verdict);
        }
        metricsConfig.recordSampleIngested(verdict.isAnomaly());

        if (verdict.isAnomaly()) {
            log.info("Anomaly detected: metric={} value={} confidence={} flaggedBy={}",
                    sample.getMetricName(), sample.getValue(),
                    String.format("%.2f", verdict.getConfidence()), verdict.getFlaggedBy());
        }

        return IngestionResult.builder()
                .metricName(sample.getMetricName())
                .timestamp(sample.getTimestamp())
                .accepted(true)
                .verdict(verdict)
                .build();
    }

    /**
     * Ingest each sample independently; a rejected sample is reported and the rest continue.
     */
    public List<IngestionResult> ingestBatch(List<MetricSampleRequest> requests) {
        List<IngestionResult> results = new ArrayList<>(requests.size());
        int rejected = 0;
        for (MetricSampleRequest request : requests) {
            try {
                results.add(ingest(request));
            } catch (InvalidSampleException e) {
                rejected++;
                results.add(IngestionResult.builder()
                        .metricName(request == null ? null : request.getMetricName())
                        .timestamp(request == null || request.getTimestamp() == null ? 0L : request.getTimestamp())
                        .accepted(false)
                        .error(e.getMessage())
                        .build());
            }
        }
        log.info("Batch ingest: {} accepted, {} rejected", requests.size() - rejected, rejected);
        return results;
    }

    /**
     * Score a hypothetical value at the current time without storing it.
     */
    public AnomalyVerdict getVerdict(String metricName, double value, Map<String, String> context) {
        MetricWindowStore.validate(metricName, value);
        MetricWindowStore.validateContext(metricName, context);
        return ensemble.evaluate(MetricSample.of(metricName, clock.millis(), value, context));
    }

    private MetricSample toSample(MetricSampleRequest request) {
        if (request == null) {
            throw new InvalidSampleException(null, "Sample must not be null");
        }
        if (request.getValue() == null) {
            throw new InvalidSampleException(request.getMetricName(),
                    "Value for metric '" + request.getMetricName() + "' is required");
        }
        MetricWindowStore.validate(request.getMetricName(), request.getValue());
        MetricWindowStore.validateContext(request.getMetricName(), request.getContext());
        long timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.millis();
        return MetricSample.of(request.getMetricName(), timestamp, request.getValue(), request.getContext());
    }

    private void checkOrdering(MetricSample sample) {
        List<MetricSample> last = store.recent(sample.getMetricName(), 1);
        if (!last.isEmpty() && sample.getTimestamp() <= last.get(0).getTimestamp()) {
            throw new InvalidSampleException(sample.getMetricName(), String.format(
                    "Out-of-order timestamp for metric '%s': %d is not after %d",
                    sample.getMetricName(), sample.getTimestamp(), last.get(0).getTimestamp()));
        }
    }

    private void publishVerdict(MetricSample sample, AnomalyVerdict verdict) {
        String derived = sample.getMetricName() + VERDICT_SUFFIX;
        try {
            store.ingest(MetricSample.of(derived, sample.getTimestamp(), verdict.getConfidence(), sample.getContext()));
        } catch (InvalidSampleException e) {
            log.warn("Could not publish verdict series {}: {}", derived, e.getMessage());
        }
    }
}
