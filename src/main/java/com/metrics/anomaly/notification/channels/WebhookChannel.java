package com.metrics.anomaly.notification.channels;

import com.metrics.anomaly.config.AlertingConfig;
import com.metrics.anomaly.exception.DispatchException;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.ChannelConfig;
import com.metrics.anomaly.model.ChannelType;
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

/**
 * POSTs the alert as JSON to {@code settings.url}.
 */
@Component
public class WebhookChannel implements NotificationChannel {

    public static final String URL = "url";

    private final RestTemplate restTemplate;

    @Autowired
    public WebhookChannel(RestTemplateBuilder builder, AlertingConfig alertingConfig) {
        AlertingConfig.Dispatch dispatch = alertingConfig.getDispatch();
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(dispatch.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(dispatch.getReadTimeoutMs()))
                .build();
    }

    WebhookChannel(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ChannelType type() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public void send(Alert alert, ChannelConfig config) throws DispatchException {
        String url = config.getSetting(URL, null);
        if (url == null) {
            throw new DispatchException(type(), "Webhook channel has no 'url' setting");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<Void> resp = restTemplate.exchange(url, HttpMethod.POST,
                    new HttpEntity<>(alert, headers), Void.class);
            if (!resp.getStatusCode().is2xxSuccessful()) {
                throw new DispatchException(type(), "HTTP " + resp.getStatusCode().value() + " from " + url);
            }
        } catch (RestClientException e) {
            throw new DispatchException(type(), "POST to " + url + " failed: " + e.getMessage(), e);
        }
    }
}
