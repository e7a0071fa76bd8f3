package com.ella.analyzer.services.bankstatements.parsers;

import java.util.List;
import java.util.OptionalInt;

import org.springframework.stereotype.Component;

import com.ella.analyzer.config.IngestionProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Procura a linha de cabeçalho das transações, pulando as linhas de dados da conta que vêm antes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeaderRowLocator {

    private final IngestionProperties properties;

    public OptionalInt locate(List<List<Object>> rows) {
        if (rows == null) {
            return OptionalInt.empty();
        }
        int limit = Math.min(rows.size(), properties.headerScanLimit());
        for (int i = 0; i < limit; i++) {
            List<Object> row = rows.get(i);
            if (row == null || row.size() < properties.minHeaderCells()) {
                continue;
            }
            if (looksLikeHeader(row)) {
                log.debug("[HeaderRowLocator] header found at index {}", i);
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    static boolean looksLikeHeader(List<Object> row) {
        boolean hasDate = false;
        boolean hasDetails = false;
        boolean hasDebit = false;
        boolean hasCredit = false;
        boolean hasBalance = false;

        for (Object cell : row) {
            String c = CellValues.normalizeHeader(cell);
            if (c.isEmpty()) {
                continue;
            }
            hasDate |= c.contains("date");
            hasDetails |= c.contains("details") || c.contains("particulars") || c.contains("description");
            hasDebit |= c.contains("debit") || c.equals("dr");
            hasCredit |= c.contains("credit") || c.equals("cr");
            hasBalance |= c.contains("balance");
        }
        return hasDate && hasDetails && hasDebit && hasCredit && hasBalance;
    }
}
