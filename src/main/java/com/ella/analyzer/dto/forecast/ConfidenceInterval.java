package com.ella.analyzer.dto.forecast;

import java.math.BigDecimal;

public record ConfidenceInterval(BigDecimal low, BigDecimal high) {
}
