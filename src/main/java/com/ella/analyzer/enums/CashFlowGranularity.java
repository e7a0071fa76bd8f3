package com.ella.analyzer.enums;

public enum CashFlowGranularity {
    DAILY,
    WEEKLY,
    MONTHLY
}
