package com.clarifi.backend.dto.dashboard;

import java.math.BigDecimal;

import com.clarifi.backend.enums.DashboardPeriod;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FinancialSummaryDTO {

    BigDecimal income;
    BigDecimal expenses;
    BigDecimal savings;
    BigDecimal budget;
    DashboardPeriod period;
}
