package com.clarifi.backend.dto.dashboard;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DashboardSummaryResponseDTO {

    FinancialSummaryDTO summary;
    Instant lastUpdated;
}
