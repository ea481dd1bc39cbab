package com.clarifi.backend.dto.dashboard;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DashboardInsightsResponseDTO {

    List<InsightDTO> insights;
    Instant lastUpdated;
}
