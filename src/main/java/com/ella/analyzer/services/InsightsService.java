package com.ella.analyzer.services;

import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Service;

import com.ella.analyzer.config.ForecastProperties;
import com.ella.analyzer.dto.DateRange;
import com.ella.analyzer.dto.analytics.Anomaly;
import com.ella.analyzer.dto.analytics.CashFlowPeriod;
import com.ella.analyzer.dto.analytics.RecurringPayment;
import com.ella.analyzer.dto.forecast.BalanceForecast;
import com.ella.analyzer.dto.forecast.CashFlowProjection;
import com.ella.analyzer.dto.forecast.ForecastWarning;
import com.ella.analyzer.dto.insights.BalanceOverviewDTO;
import com.ella.analyzer.dto.insights.CashFlowSummaryDTO;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.CashFlowGranularity;
import com.ella.analyzer.repositories.TransactionStore;
import com.ella.analyzer.services.analytics.AnomalyDetectionService;
import com.ella.analyzer.services.analytics.BalanceMetricsService;
import com.ella.analyzer.services.analytics.CashflowService;
import com.ella.analyzer.services.analytics.RecurringPaymentDetectionService;
import com.ella.analyzer.services.bankstatements.TransactionDeduplicator;
import com.ella.analyzer.services.forecast.BalanceForecastService;
import com.ella.analyzer.services.forecast.CashFlowProjectionService;
import com.ella.analyzer.services.forecast.ForecastWarningService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lê o snapshot atual do store e delega para os serviços de análise. Cada chamada recalcula tudo.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InsightsService {

    private final TransactionStore transactionStore;
    private final RecurringPaymentDetectionService recurringDetectionService;
    private final AnomalyDetectionService anomalyDetectionService;
    private final BalanceMetricsService balanceMetricsService;
    private final CashflowService cashflowService;
    private final BalanceForecastService balanceForecastService;
    private final CashFlowProjectionService cashFlowProjectionService;
    private final ForecastWarningService forecastWarningService;
    private final ForecastProperties forecastProperties;
    private final TransactionDeduplicator deduplicator;

    public List<RecurringPayment> recurringPayments() {
        return recurringDetectionService.detect(transactionStore.findAll());
    }

    public List<Anomaly> anomalies() {
        List<Anomaly> anomalies = anomalyDetectionService.detect(transactionStore.findAll());
        log.debug("[Insights] anomalies={}", anomalies.size());
        return anomalies;
    }

    public BalanceOverviewDTO balanceOverview(LocalDate start, LocalDate end) {
        List<Transaction> transactions = transactionStore.findAll();
        DateRange range = resolveRange(transactions, start, end);
        if (range == null) {
            return new BalanceOverviewDTO(balanceMetricsService.calculate(transactions), null, List.of(), 0);
        }
        return new BalanceOverviewDTO(
                balanceMetricsService.calculate(transactions, range),
                balanceMetricsService.balanceChange(transactions, range).orElse(null),
                balanceMetricsService.history(transactions, range),
                balanceMetricsService.daysBelowThreshold(transactions, forecastProperties.lowBalanceThreshold(), range));
    }

    public List<CashFlowPeriod> cashFlow(CashFlowGranularity granularity) {
        CashFlowGranularity g = granularity == null ? CashFlowGranularity.MONTHLY : granularity;
        return cashflowService.calculate(transactionStore.findAll(), g);
    }

    public CashFlowSummaryDTO cashFlowSummary(LocalDate start, LocalDate end) {
        List<Transaction> transactions = transactionStore.findAll();
        DateRange range = resolveRange(transactions, start, end);
        return new CashFlowSummaryDTO(
                range,
                cashflowService.totalIncome(transactions, range),
                cashflowService.totalExpenses(transactions, range),
                cashflowService.netCashFlow(transactions, range),
                cashflowService.savingsRate(transactions, range));
    }

    public BalanceForecast endOfMonthForecast() {
        return balanceForecastService.forecastEndOfMonth(transactionStore.findAll());
    }

    public List<CashFlowProjection> cashFlowProjection(int horizonDays) {
        if (horizonDays <= 0) {
            throw new IllegalArgumentException("Projection horizon must be a positive number of days");
        }
        return cashFlowProjectionService.project(transactionStore.findAll(), horizonDays);
    }

    public List<ForecastWarning> forecastWarnings() {
        return forecastWarningService.generateWarnings(List.of(endOfMonthForecast()));
    }

    // sem datas informadas, usa o período coberto pelo histórico
    private DateRange resolveRange(List<Transaction> transactions, LocalDate start, LocalDate end) {
        DateRange covered = deduplicator.dateRange(transactions);
        if (start == null && end == null) {
            return covered;
        }
        if (covered == null && (start == null || end == null)) {
            return null;
        }
        LocalDate s = start != null ? start : covered.start();
        LocalDate e = end != null ? end : covered.end();
        return new DateRange(s, e);
    }
}
