package com.metrics.anomaly.exception;

public class UnknownRuleException extends RuntimeException {

    private final String ruleId;

    public UnknownRuleException(String ruleId) {
        super("Unknown rule: " + ruleId);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
