package com.clarifi.backend.dto.dashboard;

import java.math.BigDecimal;

import com.clarifi.backend.enums.BudgetStatus;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BudgetComparisonDTO {

    String categoryId;
    String categoryName;
    BigDecimal budgetAmount;
    BigDecimal actualAmount;
    int percentage;
    BudgetStatus status;
    BigDecimal remainingAmount;
}
