package com.metrics.anomaly.engine;

import com.metrics.anomaly.model.AlertRule;
import lombok.Value;

/**
 * A rule whose condition held at evaluation time, with the aggregate that satisfied it.
 */
@Value
public class RuleFiring {
    AlertRule rule;
    double aggregateValue;
    long evaluatedAt;
}
