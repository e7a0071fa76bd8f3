package com.ella.analyzer.dto.forecast;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Previsão de saldo numa data. predictedBalance está sempre dentro de confidenceInterval.
 */
public record BalanceForecast(
        LocalDate date,
        BigDecimal predictedBalance,
        ConfidenceInterval confidenceInterval,
        List<String> assumptions
) {
    public BalanceForecast {
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
    }
}
