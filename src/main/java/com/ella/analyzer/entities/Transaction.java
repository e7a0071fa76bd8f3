package com.ella.analyzer.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import com.ella.analyzer.enums.PaymentChannel;
import com.ella.analyzer.enums.TransactionType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Transação canônica de extrato.
 * <p>
 * O id é função pura de data + referência + valor, então reprocessar o mesmo arquivo gera os mesmos ids.
 * Exatamente um entre debit/credit é não-nulo. tagIds só é escrito pela categorização; notes, customTags,
 * reviewed e manualTagOverride só pelo usuário.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    private String id;

    private LocalDate date;

    private String details;

    private String refNo;

    private BigDecimal debit;

    private BigDecimal credit;

    private BigDecimal balance;

    private BigDecimal amount;

    private TransactionType type;

    private PaymentChannel paymentChannel;

    @Builder.Default
    private List<String> tagIds = new ArrayList<>();

    @Builder.Default
    private boolean manualTagOverride = false;

    private String notes;

    @Builder.Default
    private List<String> customTags = new ArrayList<>();

    @Builder.Default
    private boolean reviewed = false;

    private String sourceFile;

    private LocalDateTime importedAt;

    public boolean isDebit() {
        return type == TransactionType.DEBIT;
    }

    public boolean isCredit() {
        return type == TransactionType.CREDIT;
    }
}
