package com.ella.analyzer.dto.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * period: "2024-01-15" (diário), "2024-W03" (semana ISO) ou "2024-01" (mensal).
 */
public record CashFlowPeriod(
        String period,
        LocalDate periodStart,
        LocalDate periodEnd,
        BigDecimal totalInflow,
        BigDecimal totalOutflow,
        BigDecimal netCashFlow,
        BigDecimal averageDailyInflow,
        BigDecimal averageDailyOutflow,
        int surplusDays,
        int deficitDays
) {
}
