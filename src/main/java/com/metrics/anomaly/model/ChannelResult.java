package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Outcome of delivering an alert to one channel")
public class ChannelResult {

    @Schema(description = "Channel type", example = "slack")
    ChannelType channelType;

    @Schema(description = "Whether delivery succeeded", example = "true")
    boolean success;

    @Schema(description = "Failure description, absent on success", example = "Timed out after 5000 ms")
    String error;

    @Schema(description = "Time spent on the attempt in milliseconds", example = "120")
    long durationMs;

    public static ChannelResult success(ChannelType type, long durationMs) {
        return new ChannelResult(type, true, null, durationMs);
    }

    public static ChannelResult failure(ChannelType type, String error, long durationMs) {
        return new ChannelResult(type, false, error, durationMs);
    }
}
