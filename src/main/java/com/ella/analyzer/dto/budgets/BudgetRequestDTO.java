package com.ella.analyzer.dto.budgets;

import java.math.BigDecimal;

import com.ella.analyzer.enums.BudgetPeriod;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record BudgetRequestDTO(
        @NotBlank String tagId,
        @NotNull @DecimalMin(value = "0.01") BigDecimal monthlyLimit,
        BudgetPeriod period
) {
}
