package com.ella.analyzer.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.ella.analyzer.repositories.BudgetStore;
import com.ella.analyzer.repositories.StatementStore;
import com.ella.analyzer.repositories.StoreMigrations;
import com.ella.analyzer.repositories.TagStore;
import com.ella.analyzer.repositories.TransactionStore;

@Configuration
public class StoreConfig {

    @Bean
    public StatementStore statementStore(Clock clock) {
        return StatementStore.open(StoreMigrations.defaults(clock));
    }

    @Bean
    public TransactionStore transactionStore(StatementStore store) {
        return store.transactions();
    }

    @Bean
    public TagStore tagStore(StatementStore store) {
        return store.tags();
    }

    @Bean
    public BudgetStore budgetStore(StatementStore store) {
        return store.budgets();
    }
}
