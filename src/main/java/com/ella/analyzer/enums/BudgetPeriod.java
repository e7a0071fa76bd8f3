package com.ella.analyzer.enums;

public enum BudgetPeriod {
    WEEKLY,
    MONTHLY,
    YEARLY
}
