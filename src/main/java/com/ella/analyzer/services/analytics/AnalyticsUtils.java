package com.ella.analyzer.services.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

import com.ella.analyzer.entities.Transaction;

public final class AnalyticsUtils {

    public static final int MONEY_SCALE = 2;

    private AnalyticsUtils() {
    }

    public static BigDecimal safeAmount(Transaction transaction) {
        if (transaction == null || transaction.getAmount() == null) {
            return BigDecimal.ZERO;
        }
        return transaction.getAmount();
    }

    public static BigDecimal safeDebit(Transaction transaction) {
        if (transaction == null || transaction.getDebit() == null) {
            return BigDecimal.ZERO;
        }
        return transaction.getDebit();
    }

    public static BigDecimal safeCredit(Transaction transaction) {
        if (transaction == null || transaction.getCredit() == null) {
            return BigDecimal.ZERO;
        }
        return transaction.getCredit();
    }

    public static boolean isDebit(Transaction transaction) {
        return transaction != null && transaction.isDebit() && transaction.getDate() != null;
    }

    public static List<Transaction> debits(List<Transaction> transactions) {
        if (transactions == null) {
            return List.of();
        }
        return transactions.stream().filter(AnalyticsUtils::isDebit).toList();
    }

    public static BigDecimal sum(List<BigDecimal> values) {
        if (values == null) {
            return BigDecimal.ZERO;
        }
        return values.stream().filter(Objects::nonNull).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static BigDecimal money(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }
        return BigDecimal.valueOf(value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static String formatCurrency(BigDecimal amount) {
        BigDecimal safe = amount != null ? amount : BigDecimal.ZERO;
        return "₹" + safe.setScale(MONEY_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    public static double mean(List<BigDecimal> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        int n = 0;
        for (BigDecimal v : values) {
            if (v == null) {
                continue;
            }
            sum += v.doubleValue();
            n++;
        }
        return n == 0 ? 0.0 : sum / n;
    }

    /**
     * Desvio padrão populacional (divide por n).
     */
    public static double stdDevPopulation(List<BigDecimal> values, double mean) {
        if (values == null) {
            return 0.0;
        }
        List<BigDecimal> cleaned = values.stream().filter(Objects::nonNull).toList();
        int n = cleaned.size();
        if (n == 0) {
            return 0.0;
        }
        double sumSq = 0.0;
        for (BigDecimal v : cleaned) {
            double d = v.doubleValue() - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / n);
    }
}
