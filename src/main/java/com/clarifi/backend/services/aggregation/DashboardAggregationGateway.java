package com.clarifi.backend.services.aggregation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.clarifi.backend.dto.dashboard.PeriodWindow;
import com.clarifi.backend.dto.dashboard.RecentTransactionDTO;
import com.clarifi.backend.entities.FinancialGoal;
import com.clarifi.backend.enums.AmountSign;

/**
 * Read-only access to the data the dashboard is computed from.
 * <p>
 * Every method is side-effect free and safe to call concurrently. Storage failures are reported as
 * {@link com.clarifi.backend.exceptions.DataUnavailableException}.
 */
public interface DashboardAggregationGateway {

    /**
     * Signed total of the user's transactions in {@code window} whose amount has the given sign.
     * May return {@code null} when nothing matches.
     */
    BigDecimal sumAmount(UUID userId, PeriodWindow window, AmountSign sign);

    /**
     * One entry per category that has at least one expense in {@code window}; uncategorized
     * expenses are folded into the {@value CategorySpendTotal#UNCATEGORIZED_ID} bucket.
     */
    List<CategorySpendTotal> groupSpendByCategory(UUID userId, PeriodWindow window);

    /** Most recent transactions regardless of period, newest first. */
    List<RecentTransactionDTO> recentTransactions(UUID userId, int limit);

    /** Budget rows for the calendar month containing {@code monthAnchor}. */
    List<BudgetLine> budgetLines(UUID userId, LocalDate monthAnchor);

    /** All goals of the user, newest first. */
    List<FinancialGoal> goals(UUID userId);

    /** Transactions of one category inside {@code window}, newest first. */
    List<RecentTransactionDTO> transactionsByCategory(UUID userId, String categoryId, PeriodWindow window);
}
