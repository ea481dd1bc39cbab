package com.clarifi.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BudgetStatus {
    UNDER("under"),
    ON_TRACK("on_track"),
    OVER("over");

    private final String value;

    BudgetStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static BudgetStatus fromPercentage(int percentage) {
        if (percentage > 100) {
            return OVER;
        }
        if (percentage > 80) {
            return ON_TRACK;
        }
        return UNDER;
    }
}
