package com.clarifi.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SpendingTrend {
    UP("up"),
    DOWN("down"),
    STABLE("stable");

    private final String value;

    SpendingTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
