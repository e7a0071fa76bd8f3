package com.ella.analyzer.config;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "analyzer.forecast")
public record ForecastProperties(
        BigDecimal lowBalanceThreshold,
        List<Integer> projectionPeriods
) {
    public ForecastProperties {
        if (lowBalanceThreshold == null) {
            lowBalanceThreshold = new BigDecimal("1000");
        }
        if (projectionPeriods == null || projectionPeriods.isEmpty()) {
            projectionPeriods = List.of(30, 60, 90);
        } else {
            projectionPeriods = projectionPeriods.stream().filter(p -> p != null && p > 0).sorted().toList();
        }
    }

    public static ForecastProperties defaults() {
        return new ForecastProperties(null, null);
    }
}
