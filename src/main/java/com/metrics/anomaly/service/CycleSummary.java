package com.metrics.anomaly.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.DispatchReport;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Value
@Schema(description = "Outcome of one rule evaluation cycle")
public class CycleSummary {

    @Schema(description = "Evaluation time in epoch milliseconds", example = "1739886764000")
    long evaluatedAt;

    @Schema(description = "Rules whose condition held", example = "[\"RULE-ERROR-RATE\"]")
    List<String> firedRuleIds;

    @Schema(description = "Alerts handed to the dispatcher")
    List<Alert> dispatched;

    @Schema(description = "Fired rules held back by their throttle", example = "[]")
    List<String> suppressedRuleIds;

    // Completes once every channel of every dispatched alert has reported
    @JsonIgnore
    List<CompletableFuture<DispatchReport>> pendingDispatches;

    @JsonIgnore
    public CompletableFuture<Void> allDispatched() {
        return CompletableFuture.allOf(pendingDispatches.toArray(new CompletableFuture[0]));
    }
}
