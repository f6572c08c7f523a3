package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "At most maxAlerts notifications per fixed window of durationMinutes")
public class ThrottlePolicy {

    @Schema(description = "Throttle window length in minutes", example = "15")
    private int durationMinutes;

    @Schema(description = "Maximum notifications per window", example = "3")
    private int maxAlerts;

    public long durationMs() {
        return durationMinutes * 60_000L;
    }
}
