package com.clarifi.backend.services;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import com.clarifi.backend.dto.dashboard.PeriodWindow;
import com.clarifi.backend.enums.DashboardPeriod;

class PeriodResolverTest {

    private static PeriodResolver resolverAt(String isoInstant) {
        return new PeriodResolver(Clock.fixed(Instant.parse(isoInstant), ZoneOffset.UTC));
    }

    @Test
    void currentMonth_coversWholeCalendarMonth() {
        PeriodWindow window = resolverAt("2026-03-15T10:00:00Z").resolve(DashboardPeriod.CURRENT_MONTH);

        assertThat(window.startDate()).isEqualTo(LocalDate.of(2026, 3, 1));
        assertThat(window.endDate()).isEqualTo(LocalDate.of(2026, 3, 31));
    }

    @Test
    void lastMonth_handlesShortMonthsAndYearBoundary() {
        PeriodWindow february = resolverAt("2026-03-15T10:00:00Z").resolve(DashboardPeriod.LAST_MONTH);
        assertThat(february.startDate()).isEqualTo(LocalDate.of(2026, 2, 1));
        assertThat(february.endDate()).isEqualTo(LocalDate.of(2026, 2, 28));

        PeriodWindow december = resolverAt("2026-01-05T00:00:00Z").resolve(DashboardPeriod.LAST_MONTH);
        assertThat(december.startDate()).isEqualTo(LocalDate.of(2025, 12, 1));
        assertThat(december.endDate()).isEqualTo(LocalDate.of(2025, 12, 31));
    }

    @Test
    void last30Days_isRollingAndNotCalendarAligned() {
        PeriodWindow window = resolverAt("2026-03-15T10:00:00Z").resolve(DashboardPeriod.LAST_30_DAYS);

        assertThat(window.startDate()).isEqualTo(LocalDate.of(2026, 2, 13));
        assertThat(window.endDate()).isEqualTo(LocalDate.of(2026, 3, 15));
        assertThat(window.monthAnchor()).isEqualTo(LocalDate.of(2026, 2, 1));
    }

    @Test
    void comparisonWindow_hasSameLengthAndEndsTheDayBeforeStart() {
        PeriodResolver resolver = resolverAt("2026-03-15T10:00:00Z");

        PeriodWindow march = resolver.resolve(DashboardPeriod.CURRENT_MONTH);
        PeriodWindow previous = resolver.comparisonWindow(march);

        assertThat(previous.startDate()).isEqualTo(LocalDate.of(2026, 1, 29));
        assertThat(previous.endDate()).isEqualTo(LocalDate.of(2026, 2, 28));
        assertThat(previous.lengthInDays()).isEqualTo(march.lengthInDays());

        PeriodWindow rolling = resolver.resolve(DashboardPeriod.LAST_30_DAYS);
        PeriodWindow previousRolling = resolver.comparisonWindow(rolling);
        assertThat(previousRolling.startDate()).isEqualTo(LocalDate.of(2026, 1, 13));
        assertThat(previousRolling.endDate()).isEqualTo(LocalDate.of(2026, 2, 12));
    }

    @Test
    void currentMonth_followsClock() {
        assertThat(resolverAt("2026-10-18T12:00:00Z").currentMonth()).isEqualTo(YearMonth.of(2026, 10));
    }
}
