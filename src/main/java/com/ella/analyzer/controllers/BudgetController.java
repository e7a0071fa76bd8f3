package com.ella.analyzer.controllers;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ella.analyzer.dto.ApiResponse;
import com.ella.analyzer.dto.budgets.BudgetRequestDTO;
import com.ella.analyzer.entities.Budget;
import com.ella.analyzer.services.BudgetService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
public class BudgetController {

    private final BudgetService budgetService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<Budget>>> list() {
        return ResponseEntity.ok(ApiResponse.success(budgetService.listBudgets()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Budget>> create(@Valid @RequestBody BudgetRequestDTO request) {
        Budget budget = budgetService.createOrReplace(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(budget, "Budget saved"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        budgetService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
