package com.clarifi.backend.services.insights.rules;

import java.util.Map;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.clarifi.backend.dto.dashboard.InsightDTO;
import com.clarifi.backend.dto.dashboard.SpendingByCategoryDTO;
import com.clarifi.backend.enums.InsightSeverity;
import com.clarifi.backend.enums.InsightType;
import com.clarifi.backend.enums.SpendingTrend;
import com.clarifi.backend.services.insights.InsightContext;

/**
 * Looks only at the biggest spending category (the list arrives sorted by amount).
 */
@Component
@Order(20)
public class SpendingSpikeInsightRule implements InsightRule {

    static final String INSIGHT_ID = "spending_increase";
    static final int MIN_INCREASE_PERCENTAGE = 20;

    @Override
    public Optional<InsightDTO> evaluate(InsightContext context) {
        if (context.spendingByCategory().isEmpty()) {
            return Optional.empty();
        }

        SpendingByCategoryDTO top = context.spendingByCategory().get(0);
        if (top.getTrend() != SpendingTrend.UP || top.getTrendPercentage() <= MIN_INCREASE_PERCENTAGE) {
            return Optional.empty();
        }

        return Optional.of(InsightDTO.builder()
                .id(INSIGHT_ID)
                .type(InsightType.SPENDING_ALERT)
                .title("Spending Increase")
                .description(String.format("Your %s spending increased by %d%%",
                        top.getCategoryName(), top.getTrendPercentage()))
                .severity(InsightSeverity.INFO)
                .actionable(true)
                .metadata(Map.of(
                        "category", top.getCategoryName(),
                        "increase", top.getTrendPercentage()
                ))
                .build());
    }
}
