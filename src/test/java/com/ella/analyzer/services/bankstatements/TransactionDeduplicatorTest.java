package com.ella.analyzer.services.bankstatements;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.analyzer.dto.DateRange;
import com.ella.analyzer.dto.statements.MergeResult;
import com.ella.analyzer.entities.Transaction;

@DisplayName("TransactionDeduplicator - chave composta e merge")
class TransactionDeduplicatorTest {

    private final TransactionDeduplicator deduplicator = new TransactionDeduplicator();

    private static Transaction tx(String id, LocalDate date, String ref, String details) {
        return Transaction.builder()
                .id(id)
                .date(date)
                .refNo(ref)
                .details(details)
                .amount(new BigDecimal("10.00"))
                .build();
    }

    @Test
    void compositeKey_isDayPlusReference() {
        assertEquals("20240105-ABC", TransactionDeduplicator.compositeKey(tx("1", LocalDate.of(2024, 1, 5), "ABC", "x")));
    }

    @Test
    void deduplicate_keepsFirstOccurrence_andIsIdempotent() {
        Transaction first = tx("a", LocalDate.of(2024, 1, 1), "R1", "first");
        Transaction second = tx("b", LocalDate.of(2024, 1, 1), "R1", "second");
        Transaction other = tx("c", LocalDate.of(2024, 1, 2), "R1", "other");

        List<Transaction> once = deduplicator.deduplicate(List.of(first, second, other));
        List<Transaction> twice = deduplicator.deduplicate(once);

        assertEquals(2, once.size());
        assertSame(first, once.get(0));
        assertEquals(once, twice);
    }

    @Test
    void sameReferenceOnDifferentDays_isNotDuplicate() {
        List<Transaction> kept = deduplicator.deduplicate(List.of(
                tx("a", LocalDate.of(2024, 1, 1), "R1", "x"),
                tx("b", LocalDate.of(2024, 1, 2), "R1", "x")));

        assertEquals(2, kept.size());
        assertEquals("20240101-R1", TransactionDeduplicator.compositeKey(kept.get(0)));
    }

    @Test
    void merge_reportsNewDuplicatesAndOverlap() {
        List<Transaction> existing = List.of(
                tx("e1", LocalDate.of(2024, 1, 1), "R1", "old"),
                tx("e2", LocalDate.of(2024, 1, 10), "R2", "old"));
        List<Transaction> incoming = List.of(
                tx("i1", LocalDate.of(2024, 1, 10), "R2", "new copy"),
                tx("i2", LocalDate.of(2024, 1, 15), "R3", "new"),
                tx("i3", LocalDate.of(2024, 1, 20), "R4", "new"));

        MergeResult result = deduplicator.merge(existing, incoming);

        assertEquals(4, result.transactions().size());
        assertEquals(1, result.duplicatesRemoved());
        assertEquals(2, result.newTransactions());
        assertEquals(new DateRange(LocalDate.of(2024, 1, 10), LocalDate.of(2024, 1, 10)), result.overlappingPeriod());
        assertEquals("old", result.transactions().get(1).getDetails());
    }

    @Test
    void merge_withoutOverlap_hasNullPeriod() {
        MergeResult result = deduplicator.merge(
                List.of(tx("e1", LocalDate.of(2024, 1, 1), "R1", "old")),
                List.of(tx("i1", LocalDate.of(2024, 2, 1), "R9", "new")));

        assertNull(result.overlappingPeriod());
        assertEquals(0, result.duplicatesRemoved());
        assertEquals(1, result.newTransactions());
    }

    @Test
    void sortByDateDescending_putsUndatedLast() {
        Transaction undated = tx("u", null, "R0", "x");
        List<Transaction> sorted = deduplicator.sortByDateDescending(List.of(
                tx("a", LocalDate.of(2024, 1, 1), "R1", "x"),
                undated,
                tx("b", LocalDate.of(2024, 3, 1), "R2", "x")));

        assertEquals("b", sorted.get(0).getId());
        assertEquals("a", sorted.get(1).getId());
        assertSame(undated, sorted.get(2));
    }
}
