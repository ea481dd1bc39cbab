package com.clarifi.backend.services.insights.rules;

import java.util.Map;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.clarifi.backend.dto.dashboard.InsightDTO;
import com.clarifi.backend.enums.InsightSeverity;
import com.clarifi.backend.enums.InsightType;
import com.clarifi.backend.services.insights.InsightContext;

@Component
@Order(30)
public class GoalNearCompletionInsightRule implements InsightRule {

    static final String INSIGHT_ID = "goal_progress";
    static final int NEAR_COMPLETION_PERCENTAGE = 80;

    @Override
    public Optional<InsightDTO> evaluate(InsightContext context) {
        return context.goals().stream()
                .filter(g -> g.getPercentage() >= NEAR_COMPLETION_PERCENTAGE && g.getPercentage() < 100)
                .findFirst()
                .map(goal -> InsightDTO.builder()
                        .id(INSIGHT_ID)
                        .type(InsightType.GOAL_PROGRESS)
                        .title("Goal Almost Reached")
                        .description(String.format("You're %d%% of the way to your %s goal!",
                                goal.getPercentage(), goal.getName()))
                        .severity(InsightSeverity.SUCCESS)
                        .actionable(false)
                        .metadata(Map.of(
                                "goalName", goal.getName(),
                                "percentage", goal.getPercentage()
                        ))
                        .build());
    }
}
