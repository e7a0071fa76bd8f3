package com.ella.analyzer.dto.analytics;

import java.math.BigDecimal;

/**
 * percentChange é null quando o saldo inicial é zero.
 */
public record BalanceChange(BigDecimal startBalance, BigDecimal endBalance, BigDecimal change, BigDecimal percentChange) {
}
