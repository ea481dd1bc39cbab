package com.clarifi.backend.services.insights;

import java.util.List;

import com.clarifi.backend.dto.dashboard.BudgetComparisonDTO;
import com.clarifi.backend.dto.dashboard.FinancialGoalDTO;
import com.clarifi.backend.dto.dashboard.FinancialSummaryDTO;
import com.clarifi.backend.dto.dashboard.SpendingByCategoryDTO;

/**
 * Already computed dashboard slices the insight rules read from.
 */
public record InsightContext(
        FinancialSummaryDTO summary,
        List<SpendingByCategoryDTO> spendingByCategory,
        List<BudgetComparisonDTO> budgetComparisons,
        List<FinancialGoalDTO> goals
) {
    public InsightContext {
        spendingByCategory = spendingByCategory != null ? List.copyOf(spendingByCategory) : List.of();
        budgetComparisons = budgetComparisons != null ? List.copyOf(budgetComparisons) : List.of();
        goals = goals != null ? List.copyOf(goals) : List.of();
    }
}
