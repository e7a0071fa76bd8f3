package com.ella.analyzer.services.bankstatements;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.ella.analyzer.dto.DateRange;
import com.ella.analyzer.dto.statements.MergeResult;
import com.ella.analyzer.entities.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Deduplicação por chave composta (dia, referência do banco). Mantém sempre a primeira ocorrência.
 */
@Component
@Slf4j
public class TransactionDeduplicator {

    private static final DateTimeFormatter KEY_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public static String compositeKey(Transaction t) {
        String day = t.getDate() == null ? "" : t.getDate().format(KEY_DATE);
        String ref = t.getRefNo() == null ? "" : t.getRefNo();
        return day + "-" + ref;
    }

    public List<Transaction> deduplicate(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        Map<String, Transaction> byKey = new LinkedHashMap<>();
        for (Transaction t : transactions) {
            if (t == null) {
                continue;
            }
            byKey.putIfAbsent(compositeKey(t), t);
        }
        return new ArrayList<>(byKey.values());
    }

    /**
     * Junta o que já existe com um novo upload. Em colisão de chave, a versão existente vence.
     */
    public MergeResult merge(List<Transaction> existing, List<Transaction> incoming) {
        List<Transaction> safeExisting = existing == null ? List.of() : existing;
        List<Transaction> safeIncoming = incoming == null ? List.of() : incoming;

        List<Transaction> combined = new ArrayList<>(safeExisting.size() + safeIncoming.size());
        combined.addAll(safeExisting);
        combined.addAll(safeIncoming);

        List<Transaction> merged = deduplicate(combined);
        int duplicatesRemoved = combined.size() - merged.size();
        int newTransactions = merged.size() - deduplicate(safeExisting).size();

        DateRange existingRange = dateRange(safeExisting);
        DateRange overlap = existingRange == null ? null : existingRange.intersect(dateRange(safeIncoming));

        log.info("[Merge] existing={} incoming={} merged={} duplicatesRemoved={} new={}",
                safeExisting.size(), safeIncoming.size(), merged.size(), duplicatesRemoved, newTransactions);

        return new MergeResult(merged, duplicatesRemoved, newTransactions, overlap);
    }

    public List<Transaction> sortByDateDescending(List<Transaction> transactions) {
        if (transactions == null) {
            return List.of();
        }
        List<Transaction> sorted = new ArrayList<>(transactions);
        sorted.sort(Comparator.comparing(Transaction::getDate,
                Comparator.nullsLast(Comparator.<LocalDate>reverseOrder())));
        return sorted;
    }

    public DateRange dateRange(List<Transaction> transactions) {
        if (transactions == null) {
            return null;
        }
        LocalDate min = null;
        LocalDate max = null;
        for (Transaction t : transactions) {
            LocalDate d = t == null ? null : t.getDate();
            if (d == null) {
                continue;
            }
            if (min == null || d.isBefore(min)) {
                min = d;
            }
            if (max == null || d.isAfter(max)) {
                max = d;
            }
        }
        return Objects.isNull(min) ? null : new DateRange(min, max);
    }
}
