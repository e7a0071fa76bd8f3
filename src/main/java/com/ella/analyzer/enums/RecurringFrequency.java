package com.ella.analyzer.enums;

import java.util.Optional;

/**
 * Faixas de intervalo médio (em dias, inclusivas) usadas para classificar pagamentos recorrentes.
 */
public enum RecurringFrequency {
    WEEKLY(4, 10, 7),
    MONTHLY(23, 37, 30),
    QUARTERLY(75, 105, 90),
    YEARLY(335, 395, 365);

    private final int minDays;
    private final int maxDays;
    private final int periodDays;

    RecurringFrequency(int minDays, int maxDays, int periodDays) {
        this.minDays = minDays;
        this.maxDays = maxDays;
        this.periodDays = periodDays;
    }

    public int getMinDays() {
        return minDays;
    }

    public int getMaxDays() {
        return maxDays;
    }

    public int getPeriodDays() {
        return periodDays;
    }

    public static Optional<RecurringFrequency> fromAverageInterval(double averageDays) {
        for (RecurringFrequency f : values()) {
            if (averageDays >= f.minDays && averageDays <= f.maxDays) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
