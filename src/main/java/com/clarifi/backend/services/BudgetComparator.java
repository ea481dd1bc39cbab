package com.clarifi.backend.services;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.clarifi.backend.dto.dashboard.BudgetComparisonDTO;
import com.clarifi.backend.dto.dashboard.PeriodWindow;
import com.clarifi.backend.enums.BudgetStatus;
import com.clarifi.backend.services.aggregation.BudgetLine;
import com.clarifi.backend.services.aggregation.CategorySpendTotal;
import com.clarifi.backend.services.aggregation.DashboardAggregationGateway;
import com.clarifi.backend.services.util.AmountUtils;

import lombok.RequiredArgsConstructor;

/**
 * Compares each budget line of the window's anchor month with what was actually spent in its category.
 */
@Service
@RequiredArgsConstructor
public class BudgetComparator {

    private static final Comparator<BudgetComparisonDTO> BY_PERCENTAGE_DESC =
            Comparator.comparingInt(BudgetComparisonDTO::getPercentage).reversed()
                    .thenComparing(BudgetComparisonDTO::getCategoryName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final DashboardAggregationGateway gateway;

    public List<BudgetComparisonDTO> computeBudgetComparisons(UUID userId, PeriodWindow window) {
        List<BudgetLine> lines = gateway.budgetLines(userId, window.monthAnchor());
        if (lines.isEmpty()) {
            return List.of();
        }

        // One grouped query instead of one sum per budget line.
        Map<String, BigDecimal> actualByCategory = gateway.groupSpendByCategory(userId, window).stream()
                .collect(Collectors.toMap(
                        CategorySpendTotal::categoryId,
                        t -> AmountUtils.toAmount(t.amount()),
                        BigDecimal::add
                ));

        return lines.stream()
                .map(line -> compare(line, actualByCategory.getOrDefault(line.categoryId(), BigDecimal.ZERO)))
                .sorted(BY_PERCENTAGE_DESC)
                .toList();
    }

    static BudgetComparisonDTO compare(BudgetLine line, BigDecimal actualAmount) {
        BigDecimal budgetAmount = AmountUtils.toAmount(line.amount());
        BigDecimal actual = AmountUtils.absAmount(actualAmount);
        int percentage = AmountUtils.roundedPercentage(actual, budgetAmount);

        return BudgetComparisonDTO.builder()
                .categoryId(line.categoryId())
                .categoryName(line.categoryName())
                .budgetAmount(budgetAmount)
                .actualAmount(actual)
                .percentage(percentage)
                .status(BudgetStatus.fromPercentage(percentage))
                .remainingAmount(budgetAmount.subtract(actual))
                .build();
    }
}
