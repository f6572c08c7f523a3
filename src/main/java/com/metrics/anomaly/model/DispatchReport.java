package com.metrics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.util.List;

@Value
@Schema(description = "Per-channel results of one alert dispatch")
public class DispatchReport {

    String alertId;
    List<ChannelResult> results;
    long dispatchedAt;

    public boolean anySucceeded() {
        return results.stream().anyMatch(ChannelResult::isSuccess);
    }

    public boolean allSucceeded() {
        return results.stream().allMatch(ChannelResult::isSuccess);
    }

    public long failureCount() {
        return results.stream().filter(r -> !r.isSuccess()).count();
    }
}
