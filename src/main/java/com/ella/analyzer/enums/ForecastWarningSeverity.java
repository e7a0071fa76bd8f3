package com.ella.analyzer.enums;

public enum ForecastWarningSeverity {
    WARNING,
    CRITICAL
}
