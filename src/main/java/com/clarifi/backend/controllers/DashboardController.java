package com.clarifi.backend.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.clarifi.backend.config.DashboardProperties;
import com.clarifi.backend.dto.ApiResponse;
import com.clarifi.backend.dto.dashboard.DashboardInsightsResponseDTO;
import com.clarifi.backend.dto.dashboard.DashboardSnapshotDTO;
import com.clarifi.backend.dto.dashboard.DashboardSummaryResponseDTO;
import com.clarifi.backend.dto.dashboard.RecentTransactionDTO;
import com.clarifi.backend.dto.dashboard.SpendingTrendPointDTO;
import com.clarifi.backend.enums.DashboardPeriod;
import com.clarifi.backend.services.DashboardService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
@Tag(name = "Dashboard")
public class DashboardController {

    private final DashboardService dashboardService;
    private final DashboardProperties dashboardProperties;

    @GetMapping("/{userId}")
    @Operation(summary = "Full dashboard: summary, spending by category, recent transactions, budgets, goals and insights")
    public ResponseEntity<ApiResponse<DashboardSnapshotDTO>> getDashboard(
            @PathVariable String userId,
            @RequestParam(required = false) String period
    ) {
        DashboardSnapshotDTO snapshot = dashboardService.getDashboardData(userId, DashboardPeriod.fromValue(period));
        return ResponseEntity.ok(ApiResponse.success(snapshot, "Dashboard loaded successfully"));
    }

    @GetMapping("/{userId}/summary")
    @Operation(summary = "Financial summary only")
    public ResponseEntity<ApiResponse<DashboardSummaryResponseDTO>> getSummary(
            @PathVariable String userId,
            @RequestParam(required = false) String period
    ) {
        DashboardSnapshotDTO snapshot = dashboardService.getDashboardData(userId, DashboardPeriod.fromValue(period));
        DashboardSummaryResponseDTO body = DashboardSummaryResponseDTO.builder()
                .summary(snapshot.getSummary())
                .lastUpdated(snapshot.getLastUpdated())
                .build();
        return ResponseEntity.ok(ApiResponse.success(body, "Summary loaded successfully"));
    }

    @GetMapping("/{userId}/insights")
    @Operation(summary = "Insights for the current month")
    public ResponseEntity<ApiResponse<DashboardInsightsResponseDTO>> getInsights(@PathVariable String userId) {
        DashboardSnapshotDTO snapshot = dashboardService.getDashboardData(userId, DashboardPeriod.CURRENT_MONTH);
        DashboardInsightsResponseDTO body = DashboardInsightsResponseDTO.builder()
                .insights(snapshot.getInsights())
                .lastUpdated(snapshot.getLastUpdated())
                .build();
        return ResponseEntity.ok(ApiResponse.success(body, "Insights loaded successfully"));
    }

    @GetMapping("/{userId}/transactions/category/{categoryId}")
    @Operation(summary = "Transactions of one category within the period, newest first")
    public ResponseEntity<ApiResponse<List<RecentTransactionDTO>>> getTransactionsByCategory(
            @PathVariable String userId,
            @PathVariable String categoryId,
            @RequestParam(required = false) String period
    ) {
        List<RecentTransactionDTO> txs = dashboardService.getTransactionsByCategory(
                userId, categoryId, DashboardPeriod.fromValue(period));
        return ResponseEntity.ok(ApiResponse.success(txs, "Transactions loaded successfully"));
    }

    @GetMapping("/{userId}/trends")
    @Operation(summary = "Monthly spending trends, oldest month first")
    public ResponseEntity<ApiResponse<List<SpendingTrendPointDTO>>> getSpendingTrends(
            @PathVariable String userId,
            @RequestParam(required = false) Integer months
    ) {
        int monthsToLoad = months != null ? months : dashboardProperties.defaultTrendMonths();
        List<SpendingTrendPointDTO> trends = dashboardService.getSpendingTrends(userId, monthsToLoad);
        return ResponseEntity.ok(ApiResponse.success(trends, "Trends loaded successfully"));
    }
}
