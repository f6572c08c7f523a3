package com.metrics.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComparisonOperator {
    GT(">"),
    LT("<"),
    GTE(">="),
    LTE("<="),
    EQ("=="),
    NEQ("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public boolean test(double actual, double threshold) {
        return switch (this) {
            case GT -> actual > threshold;
            case LT -> actual < threshold;
            case GTE -> actual >= threshold;
            case LTE -> actual <= threshold;
            case EQ -> Double.compare(actual, threshold) == 0;
            case NEQ -> Double.compare(actual, threshold) != 0;
        };
    }

    /**
     * Accepts either the symbol ({@code ">="}) or the constant name ({@code "GTE"}).
     */
    @JsonCreator
    public static ComparisonOperator fromValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed) || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: '" + value + "'");
    }
}
