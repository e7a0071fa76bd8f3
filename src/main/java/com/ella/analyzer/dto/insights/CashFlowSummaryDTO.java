package com.ella.analyzer.dto.insights;

import java.math.BigDecimal;

import com.ella.analyzer.dto.DateRange;

/**
 * savingsRate é percentual (0 a 100, negativo quando o gasto passa da renda). period é null sem histórico.
 */
public record CashFlowSummaryDTO(
        DateRange period,
        BigDecimal totalIncome,
        BigDecimal totalExpenses,
        BigDecimal netCashFlow,
        BigDecimal savingsRate
) {
}
