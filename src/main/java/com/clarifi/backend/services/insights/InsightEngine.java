package com.clarifi.backend.services.insights;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.clarifi.backend.dto.dashboard.BudgetComparisonDTO;
import com.clarifi.backend.dto.dashboard.FinancialGoalDTO;
import com.clarifi.backend.dto.dashboard.FinancialSummaryDTO;
import com.clarifi.backend.dto.dashboard.InsightDTO;
import com.clarifi.backend.dto.dashboard.SpendingByCategoryDTO;
import com.clarifi.backend.services.insights.rules.InsightRule;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs every {@link InsightRule} in {@code @Order} sequence. Rules are independent: each one
 * contributes at most one insight and none of them can suppress another.
 */
@Service
@Slf4j
public class InsightEngine {

    private final List<InsightRule> rules;

    public InsightEngine(List<InsightRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<InsightDTO> generateInsights(
            FinancialSummaryDTO summary,
            List<SpendingByCategoryDTO> spendingByCategory,
            List<BudgetComparisonDTO> budgetComparisons,
            List<FinancialGoalDTO> goals
    ) {
        InsightContext context = new InsightContext(summary, spendingByCategory, budgetComparisons, goals);

        List<InsightDTO> insights = new ArrayList<>(rules.size());
        for (InsightRule rule : rules) {
            rule.evaluate(context).ifPresent(insights::add);
        }

        log.debug("[InsightEngine] {} rules evaluated, {} insights produced", rules.size(), insights.size());
        return List.copyOf(insights);
    }
}
