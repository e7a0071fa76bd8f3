package com.ella.analyzer.dto.insights;

import java.util.List;

import com.ella.analyzer.dto.analytics.BalanceChange;
import com.ella.analyzer.dto.analytics.BalanceMetrics;
import com.ella.analyzer.dto.analytics.BalancePoint;

/**
 * change é null quando o período não tem saldo de abertura e fechamento.
 */
public record BalanceOverviewDTO(
        BalanceMetrics metrics,
        BalanceChange change,
        List<BalancePoint> history,
        int daysBelowLowBalance
) {
}
