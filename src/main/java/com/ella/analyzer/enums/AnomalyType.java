package com.ella.analyzer.enums;

public enum AnomalyType {
    HIGH_AMOUNT,
    DUPLICATE,
    SPENDING_SPIKE
}
