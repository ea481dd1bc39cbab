package com.clarifi.backend.services;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.clarifi.backend.dto.dashboard.FinancialSummaryDTO;
import com.clarifi.backend.dto.dashboard.PeriodWindow;
import com.clarifi.backend.enums.AmountSign;
import com.clarifi.backend.enums.DashboardPeriod;
import com.clarifi.backend.services.aggregation.BudgetLine;
import com.clarifi.backend.services.aggregation.DashboardAggregationGateway;
import com.clarifi.backend.services.util.AmountUtils;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class FinancialSummaryCalculator {

    private final DashboardAggregationGateway gateway;

    public FinancialSummaryDTO computeSummary(UUID userId, PeriodWindow window, DashboardPeriod period) {
        BigDecimal income = AmountUtils.toAmount(gateway.sumAmount(userId, window, AmountSign.POSITIVE));
        BigDecimal expenses = AmountUtils.absAmount(gateway.sumAmount(userId, window, AmountSign.NEGATIVE));

        // Rolling windows still use the budget of the month they start in.
        List<BudgetLine> budgetLines = gateway.budgetLines(userId, window.monthAnchor());
        BigDecimal budget = budgetLines.stream()
                .map(BudgetLine::amount)
                .map(AmountUtils::toAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return FinancialSummaryDTO.builder()
                .income(income)
                .expenses(expenses)
                .savings(income.subtract(expenses))
                .budget(budget)
                .period(period)
                .build();
    }
}
