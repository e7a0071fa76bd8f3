package com.ella.analyzer.dto.transactions;

import java.util.List;

import jakarta.validation.constraints.Size;

/**
 * Campos editáveis pelo usuário. Campos nulos não são alterados; informar tagIds liga o manualTagOverride.
 */
public record TransactionUpdateDTO(
        List<String> tagIds,
        Boolean manualTagOverride,
        @Size(max = 500) String notes,
        List<String> customTags,
        Boolean reviewed
) {
}
