package com.ella.analyzer.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "analyzer.recurring")
public record RecurringDetectionProperties(
        BigDecimal amountTolerance,
        int minOccurrences,
        BigDecimal loanAmountThreshold,
        BigDecimal confidenceDivisorRatio
) {
    public RecurringDetectionProperties {
        if (amountTolerance == null || amountTolerance.signum() < 0) {
            amountTolerance = new BigDecimal("0.05");
        }
        if (minOccurrences < 2) {
            minOccurrences = 2;
        }
        if (loanAmountThreshold == null) {
            loanAmountThreshold = new BigDecimal("5000");
        }
        if (confidenceDivisorRatio == null || confidenceDivisorRatio.signum() <= 0) {
            confidenceDivisorRatio = new BigDecimal("0.3");
        }
    }

    public static RecurringDetectionProperties defaults() {
        return new RecurringDetectionProperties(null, 0, null, null);
    }
}
