package com.metrics.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI metricAlertingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Metric Anomaly Alerting API")
                        .version("1.0.0")
                        .description(
                                "Streaming metric anomaly detection and alert dispatch.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Ingest samples via `POST /api/v1/metrics`\n" +
                                "2. Each sample is scored by the detection ensemble against prior history\n" +
                                "3. Every evaluation tick, alert rules compare windowed aggregates to thresholds\n" +
                                "4. Fired rules pass the per-rule throttle before notifications are sent\n" +
                                "5. Rules with an escalation policy re-notify secondary channels after a delay\n\n" +
                                "**Detection strategies:**\n" +
                                "- `statistical`: z-score against the last 1000 values (z > 3)\n" +
                                "- `time-series`: exponential smoothing forecast vs. recent volatility\n" +
                                "- `contextual`: z-score against samples from the same hour of day (z > 2.5)\n" +
                                "- `reconstruction`: nearest-neighbour reconstruction error against learned normal behaviour\n\n" +
                                "The ensemble flags a value when ANY strategy flags it; confidence is the MAX across strategies.")
                        .contact(new Contact().name("Observability Team")));
    }
}
