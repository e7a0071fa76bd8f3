package com.ella.analyzer.repositories;

import com.ella.analyzer.entities.Budget;

public interface BudgetStore extends EntityStore<Budget> {
}
