package com.ella.analyzer.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.ella.analyzer.dto.budgets.BudgetRequestDTO;
import com.ella.analyzer.entities.Budget;
import com.ella.analyzer.enums.BudgetPeriod;
import com.ella.analyzer.exceptions.BadRequestException;
import com.ella.analyzer.exceptions.ResourceNotFoundException;
import com.ella.analyzer.repositories.BudgetStore;
import com.ella.analyzer.repositories.TagStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private final BudgetStore budgetStore;
    private final TagStore tagStore;
    private final Clock clock;

    public List<Budget> listBudgets() {
        return budgetStore.findAll().stream()
                .sorted(Comparator.comparing(Budget::getTagId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Um orçamento por tag: criar de novo para a mesma tag substitui o limite anterior.
     */
    public Budget createOrReplace(BudgetRequestDTO request) {
        if (request.monthlyLimit() == null || request.monthlyLimit().signum() <= 0) {
            throw new BadRequestException("Monthly limit must be greater than zero");
        }
        if (tagStore.findById(request.tagId()).isEmpty()) {
            throw new BadRequestException("Tag does not exist: " + request.tagId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        BigDecimal limit = request.monthlyLimit().setScale(2, RoundingMode.HALF_UP);
        BudgetPeriod period = request.period() == null ? BudgetPeriod.MONTHLY : request.period();

        Budget budget = budgetStore.findAll().stream()
                .filter(b -> request.tagId().equals(b.getTagId()))
                .findFirst()
                .map(existing -> Budget.builder()
                        .id(existing.getId())
                        .tagId(existing.getTagId())
                        .monthlyLimit(limit)
                        .period(period)
                        .createdAt(existing.getCreatedAt())
                        .updatedAt(now)
                        .build())
                .orElseGet(() -> Budget.builder()
                        .id("budget-" + UUID.randomUUID())
                        .tagId(request.tagId())
                        .monthlyLimit(limit)
                        .period(period)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());

        budgetStore.saveAll(List.of(budget));
        log.info("[Budgets] saved id={} tagId={} limit={}", budget.getId(), budget.getTagId(), limit);
        return budget;
    }

    public void delete(String id) {
        if (!budgetStore.deleteById(id)) {
            throw new ResourceNotFoundException("Budget not found: " + id);
        }
    }
}
