package com.ella.analyzer.dto.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BalanceMetrics(
        BigDecimal currentBalance,
        BigDecimal highestBalance,
        BigDecimal lowestBalance,
        BigDecimal averageBalance,
        LocalDate periodStart,
        LocalDate periodEnd
) {
}
