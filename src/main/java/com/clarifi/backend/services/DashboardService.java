package com.clarifi.backend.services;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.clarifi.backend.config.DashboardProperties;
import com.clarifi.backend.dto.dashboard.BudgetComparisonDTO;
import com.clarifi.backend.dto.dashboard.DashboardSnapshotDTO;
import com.clarifi.backend.dto.dashboard.FinancialGoalDTO;
import com.clarifi.backend.dto.dashboard.FinancialSummaryDTO;
import com.clarifi.backend.dto.dashboard.InsightDTO;
import com.clarifi.backend.dto.dashboard.PeriodWindow;
import com.clarifi.backend.dto.dashboard.RecentTransactionDTO;
import com.clarifi.backend.dto.dashboard.SpendingByCategoryDTO;
import com.clarifi.backend.dto.dashboard.SpendingTrendPointDTO;
import com.clarifi.backend.enums.DashboardPeriod;
import com.clarifi.backend.exceptions.BadRequestException;
import com.clarifi.backend.exceptions.DataUnavailableException;
import com.clarifi.backend.services.aggregation.DashboardAggregationGateway;
import com.clarifi.backend.services.insights.InsightEngine;

/**
 * Builds the dashboard read model. The independent slices are fetched concurrently on the
 * dashboard executor; the first failing slice aborts the whole request.
 */
@Service
public class DashboardService {

    private static final Logger logger = LoggerFactory.getLogger(DashboardService.class);

    private final PeriodResolver periodResolver;
    private final FinancialSummaryCalculator summaryCalculator;
    private final CategorySpendAnalyzer categorySpendAnalyzer;
    private final BudgetComparator budgetComparator;
    private final GoalProgressCalculator goalProgressCalculator;
    private final DashboardAggregationGateway gateway;
    private final InsightEngine insightEngine;
    private final DashboardProperties properties;
    private final Clock clock;
    private final Executor executor;

    public DashboardService(
            PeriodResolver periodResolver,
            FinancialSummaryCalculator summaryCalculator,
            CategorySpendAnalyzer categorySpendAnalyzer,
            BudgetComparator budgetComparator,
            GoalProgressCalculator goalProgressCalculator,
            DashboardAggregationGateway gateway,
            InsightEngine insightEngine,
            DashboardProperties properties,
            Clock clock,
            @Qualifier("dashboardTaskExecutor") Executor executor
    ) {
        this.periodResolver = periodResolver;
        this.summaryCalculator = summaryCalculator;
        this.categorySpendAnalyzer = categorySpendAnalyzer;
        this.budgetComparator = budgetComparator;
        this.goalProgressCalculator = goalProgressCalculator;
        this.gateway = gateway;
        this.insightEngine = insightEngine;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
    }

    public DashboardSnapshotDTO getDashboardData(String userId, DashboardPeriod period) {
        UUID userUuid = parseUuid(userId);
        PeriodWindow window = periodResolver.resolve(period);

        logger.info("[Dashboard] 🔄 getDashboardData userId={} period={}", userId, period.getValue());
        logger.debug("[Dashboard] 📅 Window: {} -> {}", window.startDate(), window.endDate());

        CompletableFuture<FinancialSummaryDTO> summaryF =
                fetch(() -> summaryCalculator.computeSummary(userUuid, window, period));
        CompletableFuture<List<SpendingByCategoryDTO>> spendingF =
                fetch(() -> categorySpendAnalyzer.computeCategorySpend(userUuid, window));
        CompletableFuture<List<RecentTransactionDTO>> recentF =
                fetch(() -> gateway.recentTransactions(userUuid, properties.recentTransactionsLimit()));
        CompletableFuture<List<BudgetComparisonDTO>> budgetsF =
                fetch(() -> budgetComparator.computeBudgetComparisons(userUuid, window));
        CompletableFuture<List<FinancialGoalDTO>> goalsF =
                fetch(() -> goalProgressCalculator.computeGoals(userUuid));

        awaitAll(List.of(summaryF, spendingF, recentF, budgetsF, goalsF));

        FinancialSummaryDTO summary = summaryF.join();
        List<SpendingByCategoryDTO> spending = spendingF.join();
        List<BudgetComparisonDTO> budgets = budgetsF.join();
        List<FinancialGoalDTO> goals = goalsF.join();

        List<InsightDTO> insights = insightEngine.generateInsights(summary, spending, budgets, goals);

        DashboardSnapshotDTO snapshot = DashboardSnapshotDTO.builder()
                .summary(summary)
                .spendingByCategory(List.copyOf(spending))
                .recentTransactions(List.copyOf(recentF.join()))
                .budgetComparisons(List.copyOf(budgets))
                .financialGoals(List.copyOf(goals))
                .insights(insights)
                .lastUpdated(Instant.now(clock))
                .build();

        logger.info("[Dashboard] ✅ getDashboardData done: {} categories, {} budgets, {} goals, {} insights",
                spending.size(), budgets.size(), goals.size(), insights.size());
        return snapshot;
    }

    public List<RecentTransactionDTO> getTransactionsByCategory(String userId, String categoryId, DashboardPeriod period) {
        UUID userUuid = parseUuid(userId);
        PeriodWindow window = periodResolver.resolve(period);

        logger.info("[Dashboard] getTransactionsByCategory userId={} categoryId={} window {} -> {}",
                userId, categoryId, window.startDate(), window.endDate());

        return gateway.transactionsByCategory(userUuid, categoryId, window);
    }

    /**
     * Category spend for each of the last {@code months} calendar months (current month included),
     * oldest first.
     */
    public List<SpendingTrendPointDTO> getSpendingTrends(String userId, int months) {
        UUID userUuid = parseUuid(userId);
        if (months < 1 || months > properties.maxTrendMonths()) {
            throw new BadRequestException("months must be between 1 and " + properties.maxTrendMonths());
        }

        YearMonth current = periodResolver.currentMonth();
        logger.info("[Dashboard] getSpendingTrends userId={} months={} ending {}", userId, months, current);

        List<YearMonth> monthsOldestFirst = new ArrayList<>(months);
        for (int i = months - 1; i >= 0; i--) {
            monthsOldestFirst.add(current.minusMonths(i));
        }

        List<CompletableFuture<SpendingTrendPointDTO>> points = monthsOldestFirst.stream()
                .map(ym -> fetch(() -> buildTrendPoint(userUuid, ym)))
                .toList();

        awaitAll(points);

        return points.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private SpendingTrendPointDTO buildTrendPoint(UUID userId, YearMonth month) {
        List<SpendingByCategoryDTO> breakdown =
                categorySpendAnalyzer.computeCategorySpend(userId, PeriodWindow.ofMonth(month));

        BigDecimal total = breakdown.stream()
                .map(SpendingByCategoryDTO::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return SpendingTrendPointDTO.builder()
                .month(month.toString())
                .totalSpending(total)
                .categoryBreakdown(breakdown)
                .build();
    }

    // ================== CONCURRENCY HELPERS ==================

    private <T> CompletableFuture<T> fetch(Supplier<T> task) {
        Duration timeout = properties.fetchTimeout();
        try {
            return CompletableFuture.supplyAsync(task, executor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // saturated executor fails the slice like any other error
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Waits until every future completed, or until the first one failed. On failure the remaining
     * futures are cancelled and the cause is rethrown.
     */
    private void awaitAll(List<? extends CompletableFuture<?>> futures) {
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        for (CompletableFuture<?> future : futures) {
            future.whenComplete((result, error) -> {
                if (error != null) {
                    firstFailure.completeExceptionally(error);
                }
            });
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
        try {
            CompletableFuture.anyOf(all, firstFailure).join();
        } catch (CompletionException | CancellationException e) {
            futures.forEach(f -> f.cancel(true));
            RuntimeException failure = translate(e);
            logger.warn("[Dashboard] ❌ fetch aborted: {}", failure.getMessage());
            throw failure;
        }
    }

    private RuntimeException translate(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof TimeoutException) {
            return new DataUnavailableException(
                    "Dashboard data fetch timed out after " + properties.fetchTimeout().toMillis() + " ms", cause);
        }
        if (cause instanceof RejectedExecutionException) {
            return new DataUnavailableException("Dashboard executor is saturated", cause);
        }
        if (cause instanceof CancellationException) {
            return new DataUnavailableException("Dashboard data fetch was cancelled", cause);
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new DataUnavailableException("Dashboard data fetch failed", cause);
    }

    private UUID parseUuid(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BadRequestException("userId is required");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Invalid userId: " + raw);
        }
    }
}
