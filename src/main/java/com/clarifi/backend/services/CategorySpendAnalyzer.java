package com.clarifi.backend.services;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.clarifi.backend.dto.dashboard.PeriodWindow;
import com.clarifi.backend.dto.dashboard.SpendingByCategoryDTO;
import com.clarifi.backend.enums.SpendingTrend;
import com.clarifi.backend.services.aggregation.CategorySpendTotal;
import com.clarifi.backend.services.aggregation.DashboardAggregationGateway;
import com.clarifi.backend.services.util.AmountUtils;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class CategorySpendAnalyzer {

    static final BigDecimal TREND_THRESHOLD = new BigDecimal("5");

    private static final Comparator<SpendingByCategoryDTO> BY_AMOUNT_DESC =
            Comparator.comparing(SpendingByCategoryDTO::getAmount).reversed()
                    .thenComparing(SpendingByCategoryDTO::getCategoryName, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(SpendingByCategoryDTO::getCategoryId);

    private final DashboardAggregationGateway gateway;
    private final PeriodResolver periodResolver;

    public List<SpendingByCategoryDTO> computeCategorySpend(UUID userId, PeriodWindow window) {
        List<CategorySpendTotal> current = gateway.groupSpendByCategory(userId, window);
        if (current.isEmpty()) {
            return List.of();
        }

        BigDecimal totalExpenses = current.stream()
                .map(CategorySpendTotal::amount)
                .map(AmountUtils::toAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        PeriodWindow previousWindow = periodResolver.comparisonWindow(window);
        log.debug("[CategorySpend] userId={} window {} -> {} compared with {} -> {}", userId,
                window.startDate(), window.endDate(), previousWindow.startDate(), previousWindow.endDate());

        Map<String, BigDecimal> previousByCategory = gateway.groupSpendByCategory(userId, previousWindow).stream()
                .collect(Collectors.toMap(
                        CategorySpendTotal::categoryId,
                        t -> AmountUtils.toAmount(t.amount()),
                        BigDecimal::add
                ));

        return current.stream()
                .map(total -> toSpending(total, totalExpenses,
                        previousByCategory.getOrDefault(total.categoryId(), BigDecimal.ZERO)))
                .sorted(BY_AMOUNT_DESC)
                .toList();
    }

    private SpendingByCategoryDTO toSpending(CategorySpendTotal total, BigDecimal totalExpenses, BigDecimal previousAmount) {
        BigDecimal amount = AmountUtils.toAmount(total.amount());
        Trend trend = classifyTrend(amount, previousAmount);

        return SpendingByCategoryDTO.builder()
                .categoryId(total.categoryId())
                .categoryName(total.categoryName())
                .categoryIcon(total.categoryIcon())
                .categoryColor(total.categoryColor())
                .amount(amount)
                .percentage(AmountUtils.percentageOf(amount, totalExpenses))
                .transactionCount(total.transactionCount())
                .trend(trend.direction())
                .trendPercentage(trend.percentage())
                .build();
    }

    static Trend classifyTrend(BigDecimal amount, BigDecimal previousAmount) {
        BigDecimal current = AmountUtils.toAmount(amount);
        BigDecimal previous = AmountUtils.toAmount(previousAmount);

        if (previous.signum() > 0) {
            BigDecimal change = AmountUtils.changePercentage(current, previous);
            SpendingTrend direction = SpendingTrend.STABLE;
            if (change.compareTo(TREND_THRESHOLD) > 0) {
                direction = SpendingTrend.UP;
            } else if (change.compareTo(TREND_THRESHOLD.negate()) < 0) {
                direction = SpendingTrend.DOWN;
            }
            return new Trend(direction, AmountUtils.roundToInt(change.abs()));
        }
        if (current.signum() > 0) {
            return new Trend(SpendingTrend.UP, 100);
        }
        return new Trend(SpendingTrend.STABLE, 0);
    }

    record Trend(SpendingTrend direction, int percentage) {
    }
}
