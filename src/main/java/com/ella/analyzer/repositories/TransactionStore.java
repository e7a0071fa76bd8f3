package com.ella.analyzer.repositories;

import com.ella.analyzer.entities.Transaction;

public interface TransactionStore extends EntityStore<Transaction> {
}
