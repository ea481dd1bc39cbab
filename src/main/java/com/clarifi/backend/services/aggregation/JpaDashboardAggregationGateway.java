package com.clarifi.backend.services.aggregation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import com.clarifi.backend.dto.dashboard.PeriodWindow;
import com.clarifi.backend.dto.dashboard.RecentTransactionDTO;
import com.clarifi.backend.entities.Budget;
import com.clarifi.backend.entities.Category;
import com.clarifi.backend.entities.FinancialGoal;
import com.clarifi.backend.entities.Transaction;
import com.clarifi.backend.enums.AmountSign;
import com.clarifi.backend.exceptions.BadRequestException;
import com.clarifi.backend.exceptions.DataUnavailableException;
import com.clarifi.backend.repositories.BudgetRepository;
import com.clarifi.backend.repositories.FinancialGoalRepository;
import com.clarifi.backend.repositories.TransactionRepository;
import com.clarifi.backend.services.util.AmountUtils;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaDashboardAggregationGateway implements DashboardAggregationGateway {

    private final TransactionRepository transactionRepository;
    private final BudgetRepository budgetRepository;
    private final FinancialGoalRepository financialGoalRepository;

    @Override
    public BigDecimal sumAmount(UUID userId, PeriodWindow window, AmountSign sign) {
        return read("sumAmount", () -> sign == AmountSign.POSITIVE
                ? transactionRepository.sumIncomeByUserAndDateRange(userId, window.startDate(), window.endDate())
                : transactionRepository.sumExpensesByUserAndDateRange(userId, window.startDate(), window.endDate()));
    }

    @Override
    public List<CategorySpendTotal> groupSpendByCategory(UUID userId, PeriodWindow window) {
        List<TransactionRepository.CategorySpendProjection> rows = read("groupSpendByCategory",
                () -> transactionRepository.sumExpensesByCategoryForUserAndDateRange(
                        userId, window.startDate(), window.endDate()));

        return rows.stream()
                .map(this::toCategorySpendTotal)
                .toList();
    }

    @Override
    public List<RecentTransactionDTO> recentTransactions(UUID userId, int limit) {
        List<Transaction> txs = read("recentTransactions",
                () -> transactionRepository.findRecentWithDetails(userId, PageRequest.of(0, limit)));

        return txs.stream()
                .map(JpaDashboardAggregationGateway::toRecentTransaction)
                .toList();
    }

    @Override
    public List<BudgetLine> budgetLines(UUID userId, LocalDate monthAnchor) {
        LocalDate budgetMonth = monthAnchor.withDayOfMonth(1);
        List<Budget> budgets = read("budgetLines",
                () -> budgetRepository.findByUserAndMonthWithCategory(userId, budgetMonth));

        return budgets.stream()
                .map(b -> new BudgetLine(
                        String.valueOf(b.getCategory().getId()),
                        b.getCategory().getName(),
                        AmountUtils.toAmount(b.getAmount())))
                .toList();
    }

    @Override
    public List<FinancialGoal> goals(UUID userId) {
        return read("goals", () -> financialGoalRepository.findByUserIdOrderByCreatedAtDesc(userId));
    }

    @Override
    public List<RecentTransactionDTO> transactionsByCategory(UUID userId, String categoryId, PeriodWindow window) {
        List<Transaction> txs;
        if (CategorySpendTotal.UNCATEGORIZED_ID.equalsIgnoreCase(categoryId)) {
            txs = read("transactionsByCategory", () -> transactionRepository.findUncategorizedByUserAndDateRange(
                    userId, window.startDate(), window.endDate()));
        } else {
            Integer id = parseCategoryId(categoryId);
            txs = read("transactionsByCategory", () -> transactionRepository.findByUserAndCategoryAndDateRange(
                    userId, id, window.startDate(), window.endDate()));
        }

        return txs.stream()
                .map(JpaDashboardAggregationGateway::toRecentTransaction)
                .toList();
    }

    private <T> T read(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("[AggregationGateway] {} failed: {}", operation, e.getMessage());
            throw new DataUnavailableException("Dashboard data is unavailable (" + operation + ")", e);
        }
    }

    private CategorySpendTotal toCategorySpendTotal(TransactionRepository.CategorySpendProjection row) {
        if (row.getCategoryId() == null) {
            return new CategorySpendTotal(
                    CategorySpendTotal.UNCATEGORIZED_ID,
                    CategorySpendTotal.UNCATEGORIZED_NAME,
                    null,
                    null,
                    AmountUtils.absAmount(row.getTotal()),
                    row.getTransactionCount() != null ? row.getTransactionCount() : 0L);
        }
        return new CategorySpendTotal(
                String.valueOf(row.getCategoryId()),
                row.getCategoryName() != null ? row.getCategoryName() : CategorySpendTotal.UNCATEGORIZED_NAME,
                row.getCategoryIcon(),
                row.getCategoryColor(),
                AmountUtils.absAmount(row.getTotal()),
                row.getTransactionCount() != null ? row.getTransactionCount() : 0L);
    }

    private static RecentTransactionDTO toRecentTransaction(Transaction tx) {
        Category category = tx.getCategory();
        return RecentTransactionDTO.builder()
                .id(tx.getId())
                .date(tx.getDate())
                .description(tx.getDescription())
                .amount(AmountUtils.toAmount(tx.getAmount()))
                .type(tx.getType())
                .categoryName(category != null ? category.getName() : null)
                .categoryIcon(category != null ? category.getIconName() : null)
                .categoryColor(category != null ? category.getColorHex() : null)
                .merchantName(tx.getMerchant() != null ? tx.getMerchant().getDisplayName() : null)
                .build();
    }

    private static Integer parseCategoryId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BadRequestException("categoryId is required");
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new BadRequestException("Invalid categoryId: " + raw);
        }
    }
}
