package com.ella.analyzer.repositories;

import java.util.Comparator;
import java.util.List;

import com.ella.analyzer.entities.Budget;
import com.ella.analyzer.entities.Tag;
import com.ella.analyzer.entities.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Handle do armazenamento local. Criado uma vez via {@link #open(List)} e passado por referência;
 * as migrações de schema rodam na abertura.
 */
@Slf4j
public final class StatementStore {

    private TransactionStore transactions;
    private TagStore tags;
    private BudgetStore budgets;
    private int schemaVersion;

    private StatementStore() {
    }

    public static StatementStore open(List<StoreMigration> migrations) {
        StatementStore store = new StatementStore();
        List<StoreMigration> ordered = migrations.stream()
                .sorted(Comparator.comparingInt(StoreMigration::version))
                .toList();
        for (StoreMigration migration : ordered) {
            if (migration.version() <= store.schemaVersion) {
                continue;
            }
            log.info("[StatementStore] applying migration v{}: {}", migration.version(), migration.description());
            migration.apply(store);
            store.schemaVersion = migration.version();
        }
        store.requireOpen();
        return store;
    }

    void createCollections() {
        if (transactions != null) {
            return;
        }
        transactions = new InMemoryTransactionStore();
        tags = new InMemoryTagStore();
        budgets = new InMemoryBudgetStore();
    }

    public TransactionStore transactions() {
        requireOpen();
        return transactions;
    }

    public TagStore tags() {
        requireOpen();
        return tags;
    }

    public BudgetStore budgets() {
        requireOpen();
        return budgets;
    }

    public int schemaVersion() {
        return schemaVersion;
    }

    private void requireOpen() {
        if (transactions == null) {
            throw new IllegalStateException("Store collections were not created; check the schema migrations");
        }
    }

    static final class InMemoryTransactionStore extends InMemoryEntityStore<Transaction> implements TransactionStore {
        InMemoryTransactionStore() {
            super(Transaction::getId);
        }
    }

    static final class InMemoryTagStore extends InMemoryEntityStore<Tag> implements TagStore {
        InMemoryTagStore() {
            super(Tag::getId);
        }
    }

    static final class InMemoryBudgetStore extends InMemoryEntityStore<Budget> implements BudgetStore {
        InMemoryBudgetStore() {
            super(Budget::getId);
        }
    }
}
