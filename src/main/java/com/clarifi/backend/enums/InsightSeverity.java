package com.clarifi.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InsightSeverity {
    INFO("info"),
    WARNING("warning"),
    SUCCESS("success"),
    ERROR("error");

    private final String value;

    InsightSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
