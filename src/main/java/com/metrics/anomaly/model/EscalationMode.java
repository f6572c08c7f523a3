package com.metrics.anomaly.model;

/**
 * What the escalation scheduler does when a deferred escalation becomes due.
 */
public enum EscalationMode {
    /** Send the escalation regardless of the rule's current state (reminder semantics). */
    ESCALATE_UNCONDITIONALLY,
    /** Re-evaluate the rule first and drop the escalation if it no longer fires. */
    ESCALATE_IF_STILL_FIRING
}
