package com.metrics.anomaly.throttle;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

/**
 * Snapshot of a rule's throttle window.
 */
@Value
@Schema(description = "Fixed-window notification counter for a rule")
public class ThrottleState {

    @Schema(description = "Rule id", example = "RULE-ERROR-RATE")
    String ruleId;

    @Schema(description = "Start of the current window in epoch milliseconds", example = "1739886764000")
    long windowStart;

    @Schema(description = "Notifications sent in the current window", example = "2")
    int count;
}
