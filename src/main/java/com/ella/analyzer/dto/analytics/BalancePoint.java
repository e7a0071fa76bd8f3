package com.ella.analyzer.dto.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BalancePoint(LocalDate date, BigDecimal balance) {
}
