package com.ella.analyzer.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ella.analyzer.classification.CategorizationService;
import com.ella.analyzer.dto.ApiResponse;
import com.ella.analyzer.dto.transactions.TransactionUpdateDTO;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.services.TransactionService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionService transactionService;
    private final CategorizationService categorizationService;

    /**
     * Com tagIds, devolve só as transações que têm pelo menos uma dessas tags.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<Transaction>>> list(@RequestParam(required = false) List<String> tagIds) {
        List<Transaction> transactions = transactionService.listTransactions();
        if (tagIds != null && !tagIds.isEmpty()) {
            transactions = categorizationService.findByTags(transactions, tagIds);
        }
        return ResponseEntity.ok(ApiResponse.success(transactions));
    }

    @GetMapping("/untagged")
    public ResponseEntity<ApiResponse<List<Transaction>>> untagged() {
        List<Transaction> untagged = categorizationService.findUntagged(transactionService.listTransactions());
        return ResponseEntity.ok(ApiResponse.success(untagged));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Transaction>> get(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(transactionService.getTransaction(id)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ApiResponse<Transaction>> update(@PathVariable String id,
                                                           @Valid @RequestBody TransactionUpdateDTO request) {
        Transaction updated = transactionService.updateUserFields(id, request);
        return ResponseEntity.ok(ApiResponse.success(updated, "Transaction updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        transactionService.deleteTransaction(id);
        return ResponseEntity.noContent().build();
    }
}
