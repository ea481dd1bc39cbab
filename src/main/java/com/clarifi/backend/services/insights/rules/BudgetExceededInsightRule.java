package com.clarifi.backend.services.insights.rules;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.clarifi.backend.dto.dashboard.BudgetComparisonDTO;
import com.clarifi.backend.dto.dashboard.InsightDTO;
import com.clarifi.backend.enums.BudgetStatus;
import com.clarifi.backend.enums.InsightSeverity;
import com.clarifi.backend.enums.InsightType;
import com.clarifi.backend.services.insights.InsightContext;

@Component
@Order(10)
public class BudgetExceededInsightRule implements InsightRule {

    static final String INSIGHT_ID = "budget_exceeded";

    @Override
    public Optional<InsightDTO> evaluate(InsightContext context) {
        List<BudgetComparisonDTO> overBudget = context.budgetComparisons().stream()
                .filter(b -> b.getStatus() == BudgetStatus.OVER)
                .toList();
        if (overBudget.isEmpty()) {
            return Optional.empty();
        }

        int count = overBudget.size();
        List<String> categoryNames = overBudget.stream()
                .map(BudgetComparisonDTO::getCategoryName)
                .toList();

        return Optional.of(InsightDTO.builder()
                .id(INSIGHT_ID)
                .type(InsightType.BUDGET_WARNING)
                .title("Budget Exceeded")
                .description(String.format("You've exceeded your budget in %d %s",
                        count, count == 1 ? "category" : "categories"))
                .severity(InsightSeverity.WARNING)
                .actionable(true)
                .metadata(Map.of("categories", categoryNames))
                .build());
    }
}
