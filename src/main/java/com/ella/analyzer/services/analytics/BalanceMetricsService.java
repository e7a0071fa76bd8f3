package com.ella.analyzer.services.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.ella.analyzer.dto.DateRange;
import com.ella.analyzer.dto.analytics.BalanceChange;
import com.ella.analyzer.dto.analytics.BalanceMetrics;
import com.ella.analyzer.dto.analytics.BalancePoint;
import com.ella.analyzer.entities.Transaction;

/**
 * Métricas sobre o saldo corrente informado pelo banco em cada linha do extrato.
 * Dentro do mesmo dia vale a ordem do extrato: a última linha do dia é o saldo de fechamento.
 */
@Service
public class BalanceMetricsService {

    public BalanceMetrics calculate(List<Transaction> transactions) {
        return calculate(transactions, null);
    }

    public BalanceMetrics calculate(List<Transaction> transactions, DateRange range) {
        List<Transaction> sorted = chronological(transactions, range);
        if (sorted.isEmpty()) {
            BigDecimal zero = BigDecimal.ZERO.setScale(AnalyticsUtils.MONEY_SCALE);
            LocalDate start = range == null ? null : range.start();
            LocalDate end = range == null ? null : range.end();
            return new BalanceMetrics(zero, zero, zero, zero, start, end);
        }

        BigDecimal highest = null;
        BigDecimal lowest = null;
        BigDecimal total = BigDecimal.ZERO;
        for (Transaction t : sorted) {
            BigDecimal b = t.getBalance();
            highest = highest == null || b.compareTo(highest) > 0 ? b : highest;
            lowest = lowest == null || b.compareTo(lowest) < 0 ? b : lowest;
            total = total.add(b);
        }
        BigDecimal average = total.divide(BigDecimal.valueOf(sorted.size()), AnalyticsUtils.MONEY_SCALE, RoundingMode.HALF_UP);
        // o arredondamento não pode tirar a média do intervalo [menor, maior]
        average = average.max(lowest).min(highest);

        return new BalanceMetrics(
                sorted.get(sorted.size() - 1).getBalance(),
                highest,
                lowest,
                average,
                sorted.get(0).getDate(),
                sorted.get(sorted.size() - 1).getDate()
        );
    }

    public BigDecimal currentBalance(List<Transaction> transactions) {
        List<Transaction> sorted = chronological(transactions, null);
        return sorted.isEmpty() ? BigDecimal.ZERO : sorted.get(sorted.size() - 1).getBalance();
    }

    /**
     * Saldo da última transação até a data (inclusive), ou vazio se não houver nenhuma antes dela.
     */
    public Optional<BigDecimal> balanceAt(List<Transaction> transactions, LocalDate date) {
        Transaction last = null;
        for (Transaction t : chronological(transactions, null)) {
            if (t.getDate().isAfter(date)) {
                break;
            }
            last = t;
        }
        return Optional.ofNullable(last).map(Transaction::getBalance);
    }

    public Optional<BalanceChange> balanceChange(List<Transaction> transactions, DateRange range) {
        Optional<BigDecimal> start = balanceAt(transactions, range.start());
        Optional<BigDecimal> end = balanceAt(transactions, range.end());
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal change = end.get().subtract(start.get());
        BigDecimal percent = start.get().signum() == 0
                ? null
                : change.multiply(BigDecimal.valueOf(100)).divide(start.get().abs(), 2, RoundingMode.HALF_UP);
        return Optional.of(new BalanceChange(start.get(), end.get(), change, percent));
    }

    public List<BalancePoint> history(List<Transaction> transactions, DateRange range) {
        return chronological(transactions, range).stream()
                .map(t -> new BalancePoint(t.getDate(), t.getBalance()))
                .toList();
    }

    /**
     * Dias cujo saldo de fechamento ficou abaixo do limite.
     */
    public int daysBelowThreshold(List<Transaction> transactions, BigDecimal threshold, DateRange range) {
        Map<LocalDate, BigDecimal> closing = new LinkedHashMap<>();
        for (Transaction t : chronological(transactions, range)) {
            closing.put(t.getDate(), t.getBalance());
        }
        return (int) closing.values().stream().filter(b -> b.compareTo(threshold) < 0).count();
    }

    static List<Transaction> chronological(List<Transaction> transactions, DateRange range) {
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        List<Transaction> out = new ArrayList<>();
        for (Transaction t : transactions) {
            if (t == null || t.getDate() == null || t.getBalance() == null) {
                continue;
            }
            if (range != null && !range.contains(t.getDate())) {
                continue;
            }
            out.add(t);
        }
        // sort estável: preserva a ordem do extrato dentro do mesmo dia
        out.sort(Comparator.comparing(Transaction::getDate));
        return out;
    }
}
