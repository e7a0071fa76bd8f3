package com.ella.analyzer.dto.statements;

import java.util.List;

import com.ella.analyzer.dto.DateRange;
import com.ella.analyzer.entities.Transaction;

/**
 * overlappingPeriod é apenas informativo (null quando os conjuntos não se sobrepõem).
 */
public record MergeResult(
        List<Transaction> transactions,
        int duplicatesRemoved,
        int newTransactions,
        DateRange overlappingPeriod
) {
    public MergeResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
