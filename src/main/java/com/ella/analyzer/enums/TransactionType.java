package com.ella.analyzer.enums;

public enum TransactionType {
    DEBIT,
    CREDIT
}
