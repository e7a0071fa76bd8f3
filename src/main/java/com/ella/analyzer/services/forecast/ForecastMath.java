package com.ella.analyzer.services.forecast;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ella.analyzer.dto.analytics.RecurringPayment;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.services.analytics.AnalyticsUtils;

final class ForecastMath {

    static final int SCALE = 6;

    private ForecastMath() {
    }

    record DailyAverages(BigDecimal income, BigDecimal expense, long daysCovered) {
    }

    /**
     * Médias diárias de entrada e saída sobre o intervalo observado (mínimo de 1 dia).
     */
    static DailyAverages dailyAverages(List<Transaction> transactions) {
        LocalDate min = null;
        LocalDate max = null;
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expense = BigDecimal.ZERO;
        for (Transaction t : dated(transactions)) {
            min = min == null || t.getDate().isBefore(min) ? t.getDate() : min;
            max = max == null || t.getDate().isAfter(max) ? t.getDate() : max;
            income = income.add(AnalyticsUtils.safeCredit(t));
            expense = expense.add(AnalyticsUtils.safeDebit(t));
        }
        if (min == null) {
            return new DailyAverages(BigDecimal.ZERO, BigDecimal.ZERO, 1);
        }
        long days = Math.max(1, ChronoUnit.DAYS.between(min, max));
        BigDecimal d = BigDecimal.valueOf(days);
        return new DailyAverages(income.divide(d, SCALE, RoundingMode.HALF_UP),
                expense.divide(d, SCALE, RoundingMode.HALF_UP), days);
    }

    /**
     * Desvio padrão populacional do fluxo líquido diário; zero com menos de duas transações.
     */
    static BigDecimal dailyNetFlowStdDev(List<Transaction> transactions) {
        List<Transaction> dated = dated(transactions);
        if (dated.size() < 2) {
            return BigDecimal.ZERO;
        }
        Map<LocalDate, BigDecimal> daily = new LinkedHashMap<>();
        for (Transaction t : dated) {
            daily.merge(t.getDate(), AnalyticsUtils.safeCredit(t).subtract(AnalyticsUtils.safeDebit(t)), BigDecimal::add);
        }
        List<BigDecimal> flows = new ArrayList<>(daily.values());
        double mean = AnalyticsUtils.mean(flows);
        return BigDecimal.valueOf(AnalyticsUtils.stdDevPopulation(flows, mean)).setScale(SCALE, RoundingMode.HALF_UP);
    }

    static List<RecurringPayment> dueBetween(List<RecurringPayment> recurring, LocalDate from, LocalDate to) {
        if (recurring == null) {
            return List.of();
        }
        return recurring.stream()
                .filter(r -> r.nextExpectedDate() != null)
                .filter(r -> !r.nextExpectedDate().isBefore(from) && !r.nextExpectedDate().isAfter(to))
                .toList();
    }

    static BigDecimal totalAmount(List<RecurringPayment> recurring) {
        return recurring.stream()
                .map(RecurringPayment::amount)
                .filter(a -> a != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static BigDecimal money(BigDecimal value) {
        return value.setScale(AnalyticsUtils.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static List<Transaction> dated(List<Transaction> transactions) {
        if (transactions == null) {
            return List.of();
        }
        return transactions.stream().filter(t -> t != null && t.getDate() != null).toList();
    }
}
