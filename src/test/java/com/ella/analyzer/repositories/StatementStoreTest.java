package com.ella.analyzer.repositories;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.analyzer.entities.Tag;
import com.ella.analyzer.entities.Transaction;

@DisplayName("StatementStore - migrações e coleções")
class StatementStoreTest {

    private final Clock clock = Clock.systemUTC();

    @Test
    void defaultMigrations_seedElevenTags() {
        StatementStore store = StatementStore.open(StoreMigrations.defaults(clock));

        assertEquals(2, store.schemaVersion());
        assertEquals(11, store.tags().count());
        assertEquals(0, store.transactions().count());
        assertEquals(0, store.budgets().count());
    }

    @Test
    void migrationsRunInVersionOrder_regardlessOfListOrder() {
        StatementStore store = StatementStore.open(List.of(
                StoreMigrations.seedDefaultTags(clock),
                StoreMigrations.createCollections()));

        assertEquals(11, store.tags().count());
    }

    @Test
    void withoutCollectionMigration_storeIsUnusable() {
        assertThrows(IllegalStateException.class, () -> StatementStore.open(List.of()));
    }

    @Test
    void saveAll_upsertsById_andReplaceAllSwapsEverything() {
        TransactionStore transactions = StatementStore.open(StoreMigrations.defaults(clock)).transactions();
        Transaction a = Transaction.builder().id("a").date(LocalDate.of(2024, 1, 1)).details("first").build();
        Transaction a2 = a.toBuilder().details("second").build();
        Transaction b = Transaction.builder().id("b").date(LocalDate.of(2024, 1, 2)).build();

        transactions.saveAll(List.of(a, b));
        transactions.saveAll(List.of(a2));

        assertEquals(2, transactions.count());
        assertEquals("second", transactions.findById("a").orElseThrow().getDetails());

        transactions.replaceAll(List.of(b));
        assertEquals(List.of(b), transactions.findAll());
        assertFalse(transactions.findById("a").isPresent());
    }

    @Test
    void deleteById_reportsWhetherSomethingWasRemoved() {
        TagStore tags = StatementStore.open(StoreMigrations.defaults(clock)).tags();

        assertTrue(tags.deleteById("tag-1"));
        assertFalse(tags.deleteById("tag-1"));
        assertFalse(tags.deleteById(null));
    }

    @Test
    void entitiesWithoutId_areRejected() {
        TagStore tags = StatementStore.open(StoreMigrations.defaults(clock)).tags();

        assertThrows(IllegalArgumentException.class, () -> tags.saveAll(List.of(Tag.builder().name("x").build())));
        assertEquals(11, tags.count());
    }

    @Test
    void findAll_returnsDetachedCopy() {
        TagStore tags = StatementStore.open(StoreMigrations.defaults(clock)).tags();

        List<Tag> all = tags.findAll();
        all.clear();

        assertEquals(11, tags.count());
    }
}
