package com.ella.analyzer.services.forecast;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.ella.analyzer.dto.analytics.RecurringPayment;
import com.ella.analyzer.dto.forecast.BalanceForecast;
import com.ella.analyzer.dto.forecast.ConfidenceInterval;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.services.analytics.AnalyticsUtils;
import com.ella.analyzer.services.analytics.BalanceMetricsService;
import com.ella.analyzer.services.analytics.RecurringPaymentDetectionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Projeção linear do saldo: médias diárias históricas aplicadas aos dias restantes, menos os recorrentes
 * com vencimento na janela, somadas ao último saldo conhecido.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceForecastService {

    private final RecurringPaymentDetectionService recurringDetectionService;
    private final BalanceMetricsService balanceMetricsService;
    private final Clock clock;

    public BalanceForecast forecastEndOfMonth(List<Transaction> transactions) {
        return forecastEndOfMonth(transactions, recurringDetectionService.detect(transactions));
    }

    public BalanceForecast forecastEndOfMonth(List<Transaction> transactions, List<RecurringPayment> recurring) {
        LocalDate endOfMonth = YearMonth.now(clock).atEndOfMonth();
        return forecast(transactions, recurring, endOfMonth, "Already at end of month", "in month");
    }

    public BalanceForecast forecastBalance(List<Transaction> transactions, List<RecurringPayment> recurring, LocalDate targetDate) {
        return forecast(transactions, recurring, targetDate, "Target date already reached", "until " + targetDate);
    }

    private BalanceForecast forecast(List<Transaction> transactions,
                                     List<RecurringPayment> recurring,
                                     LocalDate target,
                                     String noDaysAssumption,
                                     String horizonLabel) {
        if (transactions == null || transactions.isEmpty()) {
            BigDecimal zero = ForecastMath.money(BigDecimal.ZERO);
            return new BalanceForecast(target, zero, new ConfidenceInterval(zero, zero),
                    List.of("No transaction history available"));
        }

        LocalDate today = LocalDate.now(clock);
        BigDecimal current = ForecastMath.money(balanceMetricsService.currentBalance(transactions));
        long daysRemaining = ChronoUnit.DAYS.between(today, target);
        if (daysRemaining <= 0) {
            return new BalanceForecast(target, current, new ConfidenceInterval(current, current), List.of(noDaysAssumption));
        }

        List<RecurringPayment> safeRecurring = recurring == null ? List.of() : recurring;
        ForecastMath.DailyAverages averages = ForecastMath.dailyAverages(transactions);
        BigDecimal days = BigDecimal.valueOf(daysRemaining);
        BigDecimal recurringDue = ForecastMath.totalAmount(ForecastMath.dueBetween(safeRecurring, today, target));

        BigDecimal predicted = ForecastMath.money(current
                .add(averages.income().multiply(days))
                .subtract(averages.expense().multiply(days))
                .subtract(recurringDue));
        BigDecimal margin = ForecastMath.money(ForecastMath.dailyNetFlowStdDev(transactions).multiply(days));

        List<String> assumptions = new ArrayList<>();
        assumptions.add("Based on " + transactions.size() + " historical transactions");
        assumptions.add("Average daily income: " + AnalyticsUtils.formatCurrency(averages.income()));
        assumptions.add("Average daily expenses: " + AnalyticsUtils.formatCurrency(averages.expense()));
        assumptions.add(safeRecurring.size() + " recurring payments detected");
        assumptions.add("Recurring payments due: " + AnalyticsUtils.formatCurrency(recurringDue));
        assumptions.add(daysRemaining + " days remaining " + horizonLabel);

        log.debug("[BalanceForecast] target={} current={} predicted={} margin={}", target, current, predicted, margin);
        return new BalanceForecast(target, predicted,
                new ConfidenceInterval(predicted.subtract(margin), predicted.add(margin)), assumptions);
    }
}
