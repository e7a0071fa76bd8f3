package com.ella.analyzer.services;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Service;

import com.ella.analyzer.dto.transactions.TransactionUpdateDTO;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.exceptions.ResourceNotFoundException;
import com.ella.analyzer.repositories.TransactionStore;
import com.ella.analyzer.services.bankstatements.TransactionDeduplicator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final TransactionStore transactionStore;
    private final TransactionDeduplicator deduplicator;

    public List<Transaction> listTransactions() {
        return deduplicator.sortByDateDescending(transactionStore.findAll());
    }

    public Transaction getTransaction(String id) {
        return transactionStore.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction not found: " + id));
    }

    /**
     * Atualiza só os campos do usuário. Tags definidas à mão marcam a transação como override manual,
     * e a categorização automática passa a ignorá-la. A edição parte da versão atual dentro do lock do store,
     * então não se perde para uma recategorização ou importação concorrente.
     */
    public Transaction updateUserFields(String id, TransactionUpdateDTO update) {
        AtomicReference<Transaction> result = new AtomicReference<>();
        transactionStore.update(current -> {
            List<Transaction> next = new ArrayList<>(current.size());
            for (Transaction t : current) {
                if (t.getId().equals(id)) {
                    Transaction edited = applyUserFields(t, update);
                    result.set(edited);
                    next.add(edited);
                } else {
                    next.add(t);
                }
            }
            if (result.get() == null) {
                throw new ResourceNotFoundException("Transaction not found: " + id);
            }
            return next;
        });

        Transaction updated = result.get();
        log.info("[Transactions] updated id={} manualTagOverride={}", id, updated.isManualTagOverride());
        return updated;
    }

    private static Transaction applyUserFields(Transaction current, TransactionUpdateDTO update) {
        Transaction.TransactionBuilder builder = current.toBuilder();

        if (update.tagIds() != null) {
            builder.tagIds(new ArrayList<>(update.tagIds()));
            builder.manualTagOverride(true);
        }
        if (update.manualTagOverride() != null) {
            builder.manualTagOverride(update.manualTagOverride());
        }
        if (update.notes() != null) {
            builder.notes(update.notes().isBlank() ? null : update.notes());
        }
        if (update.customTags() != null) {
            builder.customTags(new ArrayList<>(update.customTags()));
        }
        if (update.reviewed() != null) {
            builder.reviewed(update.reviewed());
        }
        return builder.build();
    }

    public void deleteTransaction(String id) {
        if (!transactionStore.deleteById(id)) {
            throw new ResourceNotFoundException("Transaction not found: " + id);
        }
    }
}
