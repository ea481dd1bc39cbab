package com.clarifi.backend.services.insights.rules;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.clarifi.backend.dto.dashboard.FinancialSummaryDTO;
import com.clarifi.backend.dto.dashboard.InsightDTO;
import com.clarifi.backend.enums.InsightSeverity;
import com.clarifi.backend.enums.InsightType;
import com.clarifi.backend.services.insights.InsightContext;
import com.clarifi.backend.services.util.AmountUtils;

@Component
@Order(40)
public class HighSavingsRateInsightRule implements InsightRule {

    static final String INSIGHT_ID = "savings_opportunity";
    static final BigDecimal MIN_SAVINGS_RATE = new BigDecimal("20");

    @Override
    public Optional<InsightDTO> evaluate(InsightContext context) {
        FinancialSummaryDTO summary = context.summary();
        if (summary == null) {
            return Optional.empty();
        }

        BigDecimal income = AmountUtils.toAmount(summary.getIncome());
        BigDecimal savings = AmountUtils.toAmount(summary.getSavings());
        if (savings.signum() <= 0 || income.signum() <= 0) {
            return Optional.empty();
        }

        BigDecimal savingsRate = savings
                .multiply(AmountUtils.ONE_HUNDRED)
                .divide(income, 6, RoundingMode.HALF_UP);
        if (savingsRate.compareTo(MIN_SAVINGS_RATE) <= 0) {
            return Optional.empty();
        }

        int rounded = AmountUtils.roundToInt(savingsRate);
        return Optional.of(InsightDTO.builder()
                .id(INSIGHT_ID)
                .type(InsightType.SAVINGS_OPPORTUNITY)
                .title("Great Savings Rate")
                .description(String.format("You're saving %d%% of your income this period!", rounded))
                .severity(InsightSeverity.SUCCESS)
                .actionable(false)
                .metadata(Map.of("savingsRate", rounded))
                .build());
    }
}
