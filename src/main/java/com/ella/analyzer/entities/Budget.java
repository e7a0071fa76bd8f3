package com.ella.analyzer.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.ella.analyzer.enums.BudgetPeriod;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Budget {

    private String id;

    private String tagId;

    private BigDecimal monthlyLimit;

    @Builder.Default
    private BudgetPeriod period = BudgetPeriod.MONTHLY;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
