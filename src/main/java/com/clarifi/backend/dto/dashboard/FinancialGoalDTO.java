package com.clarifi.backend.dto.dashboard;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import com.clarifi.backend.enums.GoalStatus;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FinancialGoalDTO {

    UUID id;
    String name;
    BigDecimal targetAmount;
    BigDecimal currentAmount;
    int percentage;
    LocalDate targetDate;
    GoalStatus status;
    String description;
    String iconName;
}
