package com.clarifi.backend.enums;

import java.util.Arrays;
import java.util.Locale;

import com.clarifi.backend.exceptions.InvalidPeriodException;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DashboardPeriod {
    CURRENT_MONTH("current_month"),
    LAST_MONTH("last_month"),
    LAST_30_DAYS("last_30_days");

    private final String value;

    DashboardPeriod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a period selector as sent by clients. Blank input falls back to {@link #CURRENT_MONTH}.
     */
    public static DashboardPeriod fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return CURRENT_MONTH;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidPeriodException(raw));
    }
}
