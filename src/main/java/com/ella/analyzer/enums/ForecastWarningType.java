package com.ella.analyzer.enums;

public enum ForecastWarningType {
    NEGATIVE_BALANCE,
    LOW_BALANCE
}
