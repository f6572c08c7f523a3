package com.metrics.anomaly.notification.channels;

import com.metrics.anomaly.config.AlertingConfig;
import com.metrics.anomaly.exception.DispatchException;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.ChannelConfig;
import com.metrics.anomaly.model.ChannelType;
import com.metrics.anomaly.notification.AlertFormatter;
import com.metrics.anomaly.notification.NotificationChannel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * Posts a formatted message to a Slack incoming webhook ({@code settings.webhookUrl}).
 */
@Component
public class SlackChannel implements NotificationChannel {

    public static final String WEBHOOK_URL = "webhookUrl";

    private final RestTemplate restTemplate;

    @Autowired
    public SlackChannel(RestTemplateBuilder builder, AlertingConfig alertingConfig) {
        AlertingConfig.Dispatch dispatch = alertingConfig.getDispatch();
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(dispatch.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(dispatch.getReadTimeoutMs()))
                .build();
    }

    SlackChannel(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ChannelType type() {
        return ChannelType.SLACK;
    }

    @Override
    public void send(Alert alert, ChannelConfig config) throws DispatchException {
        String url = config.getSetting(WEBHOOK_URL, null);
        if (url == null) {
            throw new DispatchException(type(), "Slack channel has no 'webhookUrl' setting");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, String> payload = Map.of("text", format(alert));
        try {
            ResponseEntity<String> resp = restTemplate.exchange(url, HttpMethod.POST,
                    new HttpEntity<>(payload, headers), String.class);
            if (!resp.getStatusCode().is2xxSuccessful()) {
                throw new DispatchException(type(), "Slack returned HTTP " + resp.getStatusCode().value());
            }
        } catch (RestClientException e) {
            throw new DispatchException(type(), "Slack webhook failed: " + e.getMessage(), e);
        }
    }

    static String format(Alert alert) {
        String icon = switch (alert.getSeverity()) {
            case CRITICAL -> ":rotating_light:";
            case HIGH -> ":red_circle:";
            case MEDIUM -> ":large_orange_circle:";
            case LOW -> ":large_blue_circle:";
        };
        return icon + " *" + AlertFormatter.subject(alert) + "*\n```" + AlertFormatter.body(alert) + "```";
    }
}
