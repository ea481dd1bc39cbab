package com.clarifi.backend.dto.dashboard;

import java.math.BigDecimal;

import com.clarifi.backend.enums.SpendingTrend;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SpendingByCategoryDTO {

    String categoryId;
    String categoryName;
    String categoryIcon;
    String categoryColor;
    BigDecimal amount;
    BigDecimal percentage;
    long transactionCount;
    SpendingTrend trend;
    int trendPercentage;
}
