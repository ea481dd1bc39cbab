package com.clarifi.backend.services;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.clarifi.backend.dto.dashboard.FinancialGoalDTO;
import com.clarifi.backend.entities.FinancialGoal;
import com.clarifi.backend.services.aggregation.DashboardAggregationGateway;
import com.clarifi.backend.services.util.AmountUtils;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class GoalProgressCalculator {

    private final DashboardAggregationGateway gateway;

    public List<FinancialGoalDTO> computeGoals(UUID userId) {
        return gateway.goals(userId).stream()
                .filter(Objects::nonNull)
                .map(GoalProgressCalculator::toProgress)
                .toList();
    }

    static FinancialGoalDTO toProgress(FinancialGoal goal) {
        BigDecimal target = AmountUtils.toAmount(goal.getTargetAmount());
        BigDecimal current = AmountUtils.toAmount(goal.getCurrentAmount());

        return FinancialGoalDTO.builder()
                .id(goal.getId())
                .name(goal.getName())
                .targetAmount(target)
                .currentAmount(current)
                .percentage(AmountUtils.roundedPercentage(current, target))
                .targetDate(goal.getTargetDate())
                .status(goal.getStatus())
                .description(goal.getDescription())
                .iconName(goal.getIconName())
                .build();
    }
}
