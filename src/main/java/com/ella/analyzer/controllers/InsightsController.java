package com.ella.analyzer.controllers;

import java.time.LocalDate;
import java.util.List;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ella.analyzer.dto.ApiResponse;
import com.ella.analyzer.dto.analytics.Anomaly;
import com.ella.analyzer.dto.analytics.CashFlowPeriod;
import com.ella.analyzer.dto.analytics.RecurringPayment;
import com.ella.analyzer.dto.forecast.BalanceForecast;
import com.ella.analyzer.dto.forecast.CashFlowProjection;
import com.ella.analyzer.dto.forecast.ForecastWarning;
import com.ella.analyzer.dto.insights.BalanceOverviewDTO;
import com.ella.analyzer.dto.insights.CashFlowSummaryDTO;
import com.ella.analyzer.enums.CashFlowGranularity;
import com.ella.analyzer.services.InsightsService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/insights")
@RequiredArgsConstructor
@Slf4j
public class InsightsController {

    private final InsightsService insightsService;

    @GetMapping("/recurring")
    public ResponseEntity<ApiResponse<List<RecurringPayment>>> recurring() {
        return ResponseEntity.ok(ApiResponse.success(insightsService.recurringPayments()));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<ApiResponse<List<Anomaly>>> anomalies() {
        return ResponseEntity.ok(ApiResponse.success(insightsService.anomalies()));
    }

    /**
     * Sem start/end usa todo o período importado.
     */
    @GetMapping("/balance")
    public ResponseEntity<ApiResponse<BalanceOverviewDTO>> balance(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return ResponseEntity.ok(ApiResponse.success(insightsService.balanceOverview(start, end)));
    }

    @GetMapping("/cashflow")
    public ResponseEntity<ApiResponse<List<CashFlowPeriod>>> cashflow(
            @RequestParam(defaultValue = "MONTHLY") CashFlowGranularity granularity
    ) {
        return ResponseEntity.ok(ApiResponse.success(insightsService.cashFlow(granularity)));
    }

    @GetMapping("/cashflow/summary")
    public ResponseEntity<ApiResponse<CashFlowSummaryDTO>> cashflowSummary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return ResponseEntity.ok(ApiResponse.success(insightsService.cashFlowSummary(start, end)));
    }

    @GetMapping("/forecast")
    public ResponseEntity<ApiResponse<BalanceForecast>> forecast() {
        return ResponseEntity.ok(ApiResponse.success(insightsService.endOfMonthForecast()));
    }

    @GetMapping("/forecast/cashflow")
    public ResponseEntity<ApiResponse<List<CashFlowProjection>>> cashflowProjection(
            @RequestParam(defaultValue = "90") int days
    ) {
        List<CashFlowProjection> projections = insightsService.cashFlowProjection(days);
        log.debug("[InsightsController] {} projection periods for horizon {}", projections.size(), days);
        return ResponseEntity.ok(ApiResponse.success(projections));
    }

    @GetMapping("/forecast/warnings")
    public ResponseEntity<ApiResponse<List<ForecastWarning>>> warnings() {
        return ResponseEntity.ok(ApiResponse.success(insightsService.forecastWarnings()));
    }
}
