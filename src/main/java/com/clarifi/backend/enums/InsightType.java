package com.clarifi.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InsightType {
    SPENDING_ALERT("spending_alert"),
    BUDGET_WARNING("budget_warning"),
    GOAL_PROGRESS("goal_progress"),
    SAVINGS_OPPORTUNITY("savings_opportunity");

    private final String value;

    InsightType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
