package com.ella.analyzer.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limiares do detector de anomalias.
 * duplicateAmountScale é independente da tolerância de recorrência (analyzer.recurring.amount-tolerance).
 */
@ConfigurationProperties(prefix = "analyzer.anomaly")
public record AnomalyDetectionProperties(
        BigDecimal highAmountMultiplier,
        BigDecimal highSeverityMultiplier,
        BigDecimal spikeMultiplier,
        int minMerchantGroupSize,
        Integer duplicateAmountScale
) {
    public AnomalyDetectionProperties {
        if (highAmountMultiplier == null) {
            highAmountMultiplier = new BigDecimal("3");
        }
        if (highSeverityMultiplier == null) {
            highSeverityMultiplier = new BigDecimal("5");
        }
        if (spikeMultiplier == null) {
            spikeMultiplier = new BigDecimal("2");
        }
        if (minMerchantGroupSize < 2) {
            minMerchantGroupSize = 2;
        }
        if (duplicateAmountScale == null || duplicateAmountScale < 0) {
            duplicateAmountScale = 2;
        }
    }

    public static AnomalyDetectionProperties defaults() {
        return new AnomalyDetectionProperties(null, null, null, 0, null);
    }
}
