package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Notification channel target")
public class ChannelConfig {

    @Schema(description = "Channel type", example = "webhook", allowableValues = {"email", "slack", "webhook", "sms"})
    private ChannelType type;

    @Schema(description = "Channel-specific settings", example = "{\"url\": \"https://hooks.example.com/alerts\"}")
    @Builder.Default
    private Map<String, String> settings = new HashMap<>();

    public String getSetting(String key, String defaultValue) {
        if (settings == null) return defaultValue;
        String val = settings.get(key);
        return (val == null || val.isBlank()) ? defaultValue : val;
    }

    public static ChannelConfig of(ChannelType type, Map<String, String> settings) {
        return new ChannelConfig(type, new HashMap<>(settings));
    }
}
