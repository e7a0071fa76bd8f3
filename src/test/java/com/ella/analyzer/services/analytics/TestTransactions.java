package com.ella.analyzer.services.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.PaymentChannel;
import com.ella.analyzer.enums.TransactionType;

public final class TestTransactions {

    private static int sequence;

    private TestTransactions() {
    }

    public static Transaction debit(LocalDate date, String details, String amount, String balance) {
        BigDecimal value = new BigDecimal(amount);
        return Transaction.builder()
                .id("d-" + (++sequence))
                .date(date)
                .details(details)
                .refNo("R" + sequence)
                .debit(value)
                .amount(value)
                .balance(balance == null ? null : new BigDecimal(balance))
                .type(TransactionType.DEBIT)
                .paymentChannel(PaymentChannel.classify(details))
                .build();
    }

    public static Transaction credit(LocalDate date, String details, String amount, String balance) {
        BigDecimal value = new BigDecimal(amount);
        return Transaction.builder()
                .id("c-" + (++sequence))
                .date(date)
                .details(details)
                .refNo("R" + sequence)
                .credit(value)
                .amount(value)
                .balance(balance == null ? null : new BigDecimal(balance))
                .type(TransactionType.CREDIT)
                .paymentChannel(PaymentChannel.classify(details))
                .build();
    }
}
