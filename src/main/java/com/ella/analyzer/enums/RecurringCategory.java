package com.ella.analyzer.enums;

public enum RecurringCategory {
    SUBSCRIPTION,
    LOAN,
    UTILITY,
    OTHER
}
