package com.ella.analyzer.services.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import com.ella.analyzer.dto.DateRange;
import com.ella.analyzer.dto.analytics.CashFlowPeriod;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.CashFlowGranularity;

@Service
public class CashflowService {

    public List<CashFlowPeriod> calculate(List<Transaction> transactions, CashFlowGranularity granularity) {
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        CashFlowGranularity g = granularity == null ? CashFlowGranularity.MONTHLY : granularity;

        // chave = início do período, para sair em ordem cronológica
        Map<LocalDate, List<Transaction>> grouped = new TreeMap<>();
        for (Transaction t : transactions) {
            if (t == null || t.getDate() == null) {
                continue;
            }
            grouped.computeIfAbsent(periodStart(t.getDate(), g), k -> new ArrayList<>()).add(t);
        }

        List<CashFlowPeriod> out = new ArrayList<>(grouped.size());
        for (Map.Entry<LocalDate, List<Transaction>> entry : grouped.entrySet()) {
            out.add(periodMetrics(entry.getKey(), g, entry.getValue()));
        }
        return out;
    }

    public BigDecimal totalIncome(List<Transaction> transactions, DateRange range) {
        return total(transactions, range, true);
    }

    public BigDecimal totalExpenses(List<Transaction> transactions, DateRange range) {
        return total(transactions, range, false);
    }

    public BigDecimal netCashFlow(List<Transaction> transactions, DateRange range) {
        return totalIncome(transactions, range).subtract(totalExpenses(transactions, range));
    }

    /**
     * Percentual da renda que sobrou no período; zero quando não houve renda.
     */
    public BigDecimal savingsRate(List<Transaction> transactions, DateRange range) {
        BigDecimal income = totalIncome(transactions, range);
        if (income.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return netCashFlow(transactions, range).multiply(BigDecimal.valueOf(100))
                .divide(income, 2, RoundingMode.HALF_UP);
    }

    private CashFlowPeriod periodMetrics(LocalDate start, CashFlowGranularity g, List<Transaction> txs) {
        BigDecimal inflow = BigDecimal.ZERO;
        BigDecimal outflow = BigDecimal.ZERO;
        Map<LocalDate, BigDecimal> dailyNet = new HashMap<>();

        for (Transaction t : txs) {
            BigDecimal amount = AnalyticsUtils.safeAmount(t);
            if (t.isCredit()) {
                inflow = inflow.add(amount);
                dailyNet.merge(t.getDate(), amount, BigDecimal::add);
            } else {
                outflow = outflow.add(amount);
                dailyNet.merge(t.getDate(), amount.negate(), BigDecimal::add);
            }
        }

        BigDecimal days = BigDecimal.valueOf(Math.max(1, dailyNet.size()));
        int surplus = (int) dailyNet.values().stream().filter(v -> v.signum() > 0).count();
        int deficit = (int) dailyNet.values().stream().filter(v -> v.signum() < 0).count();

        return new CashFlowPeriod(
                periodKey(start, g),
                start,
                periodEnd(start, g),
                inflow,
                outflow,
                inflow.subtract(outflow),
                inflow.divide(days, AnalyticsUtils.MONEY_SCALE, RoundingMode.HALF_UP),
                outflow.divide(days, AnalyticsUtils.MONEY_SCALE, RoundingMode.HALF_UP),
                surplus,
                deficit
        );
    }

    private BigDecimal total(List<Transaction> transactions, DateRange range, boolean credits) {
        BigDecimal total = BigDecimal.ZERO;
        if (transactions == null) {
            return total;
        }
        for (Transaction t : transactions) {
            if (t == null || (range != null && !range.contains(t.getDate()))) {
                continue;
            }
            if (credits ? t.isCredit() : t.isDebit()) {
                total = total.add(AnalyticsUtils.safeAmount(t));
            }
        }
        return total;
    }

    static LocalDate periodStart(LocalDate date, CashFlowGranularity g) {
        return switch (g) {
            case DAILY -> date;
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY -> date.withDayOfMonth(1);
        };
    }

    static LocalDate periodEnd(LocalDate start, CashFlowGranularity g) {
        return switch (g) {
            case DAILY -> start;
            case WEEKLY -> start.plusDays(6);
            case MONTHLY -> YearMonth.from(start).atEndOfMonth();
        };
    }

    static String periodKey(LocalDate start, CashFlowGranularity g) {
        return switch (g) {
            case DAILY -> start.toString();
            case WEEKLY -> String.format("%d-W%02d",
                    start.get(IsoFields.WEEK_BASED_YEAR), start.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTHLY -> YearMonth.from(start).toString();
        };
    }
}
