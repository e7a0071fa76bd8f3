package com.ella.analyzer.enums;

public enum DiagnosticSeverity {
    WARNING,
    ERROR
}
