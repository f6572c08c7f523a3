package com.metrics.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Append each accepted sample's ensemble confidence as '<metric>.anomaly_confidence'
    private boolean publishVerdicts = true;

    // Zone used for hour-of-day / day-of-week bucketing
    private String timeZone = "UTC";

    private Statistical statistical = new Statistical();
    private TimeSeries timeSeries = new TimeSeries();
    private Contextual contextual = new Contextual();
    private Reconstruction reconstruction = new Reconstruction();

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    @Data
    public static class Statistical {
        private int historySize = 1000;
        private int minSamples = 30;
        private double zScoreThreshold = 3.0;
    }

    @Data
    public static class TimeSeries {
        private int historySize = 100;
        private int minSamples = 10;
        // Exponential smoothing factor (0 < alpha <= 1). Higher = faster adaptation.
        private double alpha = 0.3;
        // Allowed |actual - predicted| as a multiple of recent standard deviation
        private double deviationMultiplier = 3.0;
    }

    @Data
    public static class Contextual {
        private int historySize = 1000;
        private int minSimilarSamples = 5;
        private double zScoreThreshold = 2.5;
        // Context tags that must match for a historical sample to count as similar
        private List<String> matchKeys = new ArrayList<>();
    }

    @Data
    public static class Reconstruction {
        private boolean enabled = true;
        private int minTrainingSamples = 50;
        private int maxTrainingSamples = 500;
        // Retrain after this many newly learned observations
        private int retrainEvery = 25;
        private int neighbours = 5;
        // Threshold = quantile of training reconstruction errors * margin, floored at minThreshold
        private double thresholdQuantile = 0.99;
        private double thresholdMargin = 1.5;
        private double minThreshold = 0.5;
        // Numeric context tags appended to the feature vector, in this order
        private List<String> contextSignals = new ArrayList<>();
        private int trainingPoolSize = 2;
        private int trainingQueueCapacity = 32;
    }
}
