package com.penny.ledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BudgetHealth {
    SAFE("safe"),
    WARNING("warning"),
    DANGER("danger"),
    EXCEEDED("exceeded");

    private final String value;

    BudgetHealth(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Bands are inclusive on their lower edge: 70 is a warning, 90 is danger, 100 is exceeded.
     */
    public static BudgetHealth of(int percentage, boolean exceeded) {
        if (exceeded || percentage >= 100) {
            return EXCEEDED;
        }
        if (percentage >= 90) {
            return DANGER;
        }
        if (percentage >= 70) {
            return WARNING;
        }
        return SAFE;
    }
}
