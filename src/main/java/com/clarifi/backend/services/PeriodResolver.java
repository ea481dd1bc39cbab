package com.clarifi.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;

import org.springframework.stereotype.Component;

import com.clarifi.backend.dto.dashboard.PeriodWindow;
import com.clarifi.backend.enums.DashboardPeriod;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class PeriodResolver {

    static final int ROLLING_WINDOW_DAYS = 30;

    private final Clock clock;

    public PeriodWindow resolve(DashboardPeriod period) {
        LocalDate today = LocalDate.now(clock);
        YearMonth currentMonth = YearMonth.from(today);

        return switch (period) {
            case CURRENT_MONTH -> PeriodWindow.ofMonth(currentMonth);
            case LAST_MONTH -> PeriodWindow.ofMonth(currentMonth.minusMonths(1));
            case LAST_30_DAYS -> new PeriodWindow(today.minusDays(ROLLING_WINDOW_DAYS), today);
        };
    }

    /**
     * Window of the same length that ends the day before {@code window} starts.
     */
    public PeriodWindow comparisonWindow(PeriodWindow window) {
        long length = window.lengthInDays();
        LocalDate previousEnd = window.startDate().minusDays(1);
        LocalDate previousStart = window.startDate().minusDays(length);
        return new PeriodWindow(previousStart, previousEnd);
    }

    public YearMonth currentMonth() {
        return YearMonth.now(clock);
    }
}
