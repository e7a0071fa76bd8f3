package com.ella.analyzer.dto.forecast;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.ella.analyzer.dto.analytics.RecurringPayment;

/**
 * Projeção para os próximos periodDays dias. expectedOutflow já inclui os recorrentes da janela.
 */
public record CashFlowProjection(
        String period,
        int periodDays,
        LocalDate endDate,
        BigDecimal expectedInflow,
        BigDecimal expectedOutflow,
        BigDecimal netFlow,
        List<RecurringPayment> recurringPayments
) {
    public CashFlowProjection {
        recurringPayments = recurringPayments == null ? List.of() : List.copyOf(recurringPayments);
    }
}
