package com.metrics.anomaly.config;

import com.metrics.anomaly.model.EscalationMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerting")
public class AlertingConfig {

    // Per-metric window bounds
    private Window window = new Window();

    // Periodic rule evaluation
    private Evaluation evaluation = new Evaluation();

    // Deferred escalation behaviour
    private Escalation escalation = new Escalation();

    // Channel fan-out worker pool and timeouts
    private Dispatch dispatch = new Dispatch();

    // How many dispatched alerts are kept in memory for GET /alerts
    private int recentAlertCapacity = 200;

    @Data
    public static class Window {
        private int maxSamples = 1000;
        // 0 disables age-based eviction
        private long maxAgeMinutes = 0;

        public long maxAgeMs() {
            return maxAgeMinutes * 60_000L;
        }
    }

    @Data
    public static class Evaluation {
        private boolean enabled = true;
        private int tickSeconds = 30;
    }

    @Data
    public static class Escalation {
        private EscalationMode mode = EscalationMode.ESCALATE_UNCONDITIONALLY;
        private long pollIntervalMs = 1000;
        private String messagePrefix = "[ESCALATION] ";
    }

    @Data
    public static class Dispatch {
        private long channelTimeoutMs = 5000;
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 200;
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 5000;
    }
}
