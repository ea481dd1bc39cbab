package com.clarifi.backend.dto.dashboard;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Complete dashboard for one request. Built once, never mutated afterwards.
 */
@Value
@Builder
public class DashboardSnapshotDTO {

    FinancialSummaryDTO summary;
    List<SpendingByCategoryDTO> spendingByCategory;
    List<RecentTransactionDTO> recentTransactions;
    List<BudgetComparisonDTO> budgetComparisons;
    List<FinancialGoalDTO> financialGoals;
    List<InsightDTO> insights;
    Instant lastUpdated;
}
