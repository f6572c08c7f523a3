package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Deferred re-notification to secondary channels")
public class EscalationPolicy {

    @Schema(description = "Delay after the original dispatch, in minutes", example = "30")
    private int delayMinutes;

    @Schema(description = "Channels notified on escalation")
    @Builder.Default
    private List<ChannelConfig> channels = new ArrayList<>();

    public long delayMs() {
        return delayMinutes * 60_000L;
    }
}
