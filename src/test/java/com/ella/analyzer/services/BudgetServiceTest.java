package com.ella.analyzer.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.analyzer.dto.budgets.BudgetRequestDTO;
import com.ella.analyzer.entities.Budget;
import com.ella.analyzer.enums.BudgetPeriod;
import com.ella.analyzer.exceptions.BadRequestException;
import com.ella.analyzer.exceptions.ResourceNotFoundException;
import com.ella.analyzer.repositories.StatementStore;
import com.ella.analyzer.repositories.StoreMigrations;

@DisplayName("BudgetService - orçamentos por tag")
class BudgetServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-01T09:00:00Z"), ZoneOffset.UTC);

    private StatementStore store;
    private BudgetService service;

    @BeforeEach
    void setUp() {
        store = StatementStore.open(StoreMigrations.defaults(CLOCK));
        service = new BudgetService(store.budgets(), store.tags(), CLOCK);
    }

    @Test
    void create_defaultsToMonthlyAndRoundsLimit() {
        Budget budget = service.createOrReplace(new BudgetRequestDTO("tag-1", new BigDecimal("4999.999"), null));

        assertTrue(budget.getId().startsWith("budget-"));
        assertEquals(new BigDecimal("5000.00"), budget.getMonthlyLimit());
        assertEquals(BudgetPeriod.MONTHLY, budget.getPeriod());
        assertEquals(1, store.budgets().count());
    }

    @Test
    void secondBudgetForSameTag_replacesLimit() {
        Budget first = service.createOrReplace(new BudgetRequestDTO("tag-2", new BigDecimal("3000"), null));
        Budget second = service.createOrReplace(new BudgetRequestDTO("tag-2", new BigDecimal("4500"), null));

        assertEquals(first.getId(), second.getId());
        assertEquals(first.getCreatedAt(), second.getCreatedAt());
        assertEquals(new BigDecimal("4500.00"), second.getMonthlyLimit());
        assertEquals(1, service.listBudgets().size());
    }

    @Test
    void unknownTag_isRejected() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> service.createOrReplace(new BudgetRequestDTO("tag-999", BigDecimal.TEN, null)));

        assertEquals("Tag does not exist: tag-999", ex.getMessage());
    }

    @Test
    void nonPositiveLimit_isRejected() {
        assertThrows(BadRequestException.class,
                () -> service.createOrReplace(new BudgetRequestDTO("tag-1", BigDecimal.ZERO, null)));
    }

    @Test
    void list_isOrderedByTag() {
        service.createOrReplace(new BudgetRequestDTO("tag-3", BigDecimal.ONE, null));
        service.createOrReplace(new BudgetRequestDTO("tag-1", BigDecimal.ONE, null));

        assertEquals(List.of("tag-1", "tag-3"), service.listBudgets().stream().map(Budget::getTagId).toList());
    }

    @Test
    void delete_unknownBudget_isNotFound() {
        Budget budget = service.createOrReplace(new BudgetRequestDTO("tag-1", BigDecimal.TEN, null));

        service.delete(budget.getId());

        assertEquals(0, store.budgets().count());
        assertThrows(ResourceNotFoundException.class, () -> service.delete(budget.getId()));
    }
}
