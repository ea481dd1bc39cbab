package com.clarifi.backend.dto.dashboard;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Inclusive {@code [startDate, endDate]} date interval used to bound aggregations.
 */
public record PeriodWindow(LocalDate startDate, LocalDate endDate) {

    public PeriodWindow {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate " + endDate + " is before startDate " + startDate);
        }
    }

    public static PeriodWindow ofMonth(YearMonth month) {
        return new PeriodWindow(month.atDay(1), month.atEndOfMonth());
    }

    /** Number of days covered, both ends included. */
    public long lengthInDays() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    /** First day of the calendar month containing {@link #startDate()}. */
    public LocalDate monthAnchor() {
        return startDate.withDayOfMonth(1);
    }
}
