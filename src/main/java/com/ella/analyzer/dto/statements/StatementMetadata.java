package com.ella.analyzer.dto.statements;

import java.time.LocalDateTime;

import com.ella.analyzer.dto.DateRange;

public record StatementMetadata(
        String fileName,
        String bankName,
        DateRange statementPeriod,
        int transactionCount,
        LocalDateTime parsedAt
) {
}
