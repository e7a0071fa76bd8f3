package com.ella.analyzer.dto.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.ella.analyzer.enums.RecurringCategory;
import com.ella.analyzer.enums.RecurringFrequency;

/**
 * Pagamento recorrente detectado. Derivado, recalculado a cada chamada e nunca persistido.
 */
public record RecurringPayment(
        String merchant,
        BigDecimal amount,
        RecurringFrequency frequency,
        LocalDate lastPaymentDate,
        LocalDate nextExpectedDate,
        RecurringCategory category,
        int confidence,
        int occurrences
) {
}
