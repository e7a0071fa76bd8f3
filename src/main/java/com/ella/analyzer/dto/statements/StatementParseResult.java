package com.ella.analyzer.dto.statements;

import java.util.List;

import com.ella.analyzer.dto.DateRange;
import com.ella.analyzer.entities.Transaction;

/**
 * Resultado de uma importação. success é falso quando há qualquer diagnóstico de severidade ERROR;
 * nesse caso transactions vem vazia.
 */
public record StatementParseResult(
        boolean success,
        List<Transaction> transactions,
        DateRange dateRange,
        List<ParseDiagnostic> diagnostics,
        StatementMetadata metadata
) {
    public StatementParseResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public List<ParseDiagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }
}
