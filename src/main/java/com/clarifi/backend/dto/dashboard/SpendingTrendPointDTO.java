package com.clarifi.backend.dto.dashboard;

import java.math.BigDecimal;
import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SpendingTrendPointDTO {

    String month; // yyyy-MM
    BigDecimal totalSpending;
    List<SpendingByCategoryDTO> categoryBreakdown;
}
