package com.metrics.anomaly.service;

import com.metrics.anomaly.config.DetectionConfig;
import com.metrics.anomaly.config.MetricsConfig;
import com.metrics.anomaly.engine.reconstruction.FeatureExtractor;
import com.metrics.anomaly.engine.reconstruction.ReconstructionModel;
import com.metrics.anomaly.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the per-metric reconstruction models.
 *
 * Non-anomalous samples are fed to {@link #learn(MetricSample)}, which keeps a bounded buffer of
 * training vectors. Every {@code retrainEvery} learned samples (once the buffer holds
 * {@code minTrainingSamples}) a retrain is submitted to the training executor. At most one
 * retrain per metric is in flight; a failed retrain keeps the previous model.
 */
@Service
public class ReconstructionModelService {

    private static final Logger log = LoggerFactory.getLogger(ReconstructionModelService.class);

    private final DetectionConfig.Reconstruction config;
    private final FeatureExtractor featureExtractor;
    private final Executor trainingExecutor;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final Map<String, MetricModelState> states = new ConcurrentHashMap<>();

    public ReconstructionModelService(DetectionConfig detectionConfig,
                                      @Qualifier("trainingExecutor") Executor trainingExecutor,
                                      MetricsConfig metricsConfig,
                                      Clock clock) {
        this.config = detectionConfig.getReconstruction();
        this.featureExtractor = new FeatureExtractor(detectionConfig.zoneId(), config.getContextSignals());
        this.trainingExecutor = trainingExecutor;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public FeatureExtractor getFeatureExtractor() {
        return featureExtractor;
    }

    public void learn(MetricSample sample) {
        if (!config.isEnabled()) {
            return;
        }
        MetricModelState state = states.computeIfAbsent(sample.getMetricName(), MetricModelState::new);
        boolean retrainDue;
        synchronized (state) {
            state.buffer.addLast(featureExtractor.extract(sample));
            while (state.buffer.size() > config.getMaxTrainingSamples()) {
                state.buffer.removeFirst();
            }
            state.learnedSinceTraining++;
            retrainDue = state.buffer.size() >= config.getMinTrainingSamples()
                    && (state.model == null || state.learnedSinceTraining >= config.getRetrainEvery());
        }
        if (retrainDue) {
            scheduleRetrain(state);
        }
    }

    private void scheduleRetrain(MetricModelState state) {
        if (!state.training.compareAndSet(false, true)) {
            return;
        }
        try {
            trainingExecutor.execute(() -> {
                try {
                    train(state);
                } finally {
                    state.training.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            state.training.set(false);
            log.warn("Training queue full, skipping retrain for metric {}", state.metricName);
        }
    }

    /**
     * Train synchronously from the current buffer.
     *
     * @return true if a new model was installed
     */
    public boolean trainNow(String metricName) {
        MetricModelState state = states.get(metricName);
        if (state == null) {
            log.warn("No training data for metric {}. Skipping training.", metricName);
            return false;
        }
        return train(state);
    }

    private boolean train(MetricModelState state) {
        double[][] data;
        synchronized (state) {
            if (state.buffer.size() < config.getMinTrainingSamples()) {
                log.warn("Metric {} has insufficient history ({} samples). Skipping training.",
                        state.metricName, state.buffer.size());
                return false;
            }
            data = state.buffer.toArray(new double[0][]);
            state.learnedSinceTraining = 0;
        }

        try {
            ReconstructionModel model = ReconstructionModel.train(data, config.getNeighbours(),
                    config.getThresholdQuantile(), config.getThresholdMargin(),
                    config.getMinThreshold(), clock.millis());
            state.model = model;
            state.lastFailure = null;
            log.info("Trained reconstruction model for {}: {} samples, {} features, threshold={}",
                    state.metricName, data.length, model.getFeatureCount(),
                    String.format("%.4f", model.getThreshold()));
            return true;
        } catch (RuntimeException e) {
            state.lastFailure = e.getMessage();
            metricsConfig.recordTrainingFailure();
            log.error("Failed to train reconstruction model for {}, keeping previous model",
                    state.metricName, e);
            return false;
        }
    }

    public ReconstructionModel model(String metricName) {
        MetricModelState state = states.get(metricName);
        return state == null ? null : state.model;
    }

    /**
     * Metadata about the current model, or null when the metric has never been trained.
     */
    public Map<String, Object> getModelMetadata(String metricName) {
        MetricModelState state = states.get(metricName);
        if (state == null || state.model == null) {
            return null;
        }
        ReconstructionModel model = state.model;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("metricName", metricName);
        metadata.put("trainingSamples", model.getTrainingSamples());
        metadata.put("featureCount", model.getFeatureCount());
        metadata.put("features", featureExtractor.featureNames());
        metadata.put("neighbours", model.getNeighbours());
        metadata.put("threshold", model.getThreshold());
        metadata.put("trainedAt", model.getTrainedAt());
        synchronized (state) {
            metadata.put("bufferedSamples", state.buffer.size());
        }
        if (state.lastFailure != null) {
            metadata.put("lastFailure", state.lastFailure);
        }
        return metadata;
    }

    private static final class MetricModelState {
        private final String metricName;
        private final Deque<double[]> buffer = new ArrayDeque<>();
        private final AtomicBoolean training = new AtomicBoolean(false);
        private int learnedSinceTraining;
        private volatile ReconstructionModel model;
        private volatile String lastFailure;

        private MetricModelState(String metricName) {
            this.metricName = metricName;
        }
    }
}
