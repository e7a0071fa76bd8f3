package com.ella.analyzer.dto.statements;

import com.ella.analyzer.enums.DiagnosticSeverity;

/**
 * Problema encontrado durante a importação.
 * row é a linha 1-based da planilha (0 quando o erro é do arquivo inteiro); column é o cabeçalho, quando houver.
 */
public record ParseDiagnostic(int row, String column, String message, DiagnosticSeverity severity) {

    public static ParseDiagnostic warning(int row, String column, String message) {
        return new ParseDiagnostic(row, column, message, DiagnosticSeverity.WARNING);
    }

    public static ParseDiagnostic error(int row, String message) {
        return new ParseDiagnostic(row, null, message, DiagnosticSeverity.ERROR);
    }

    public boolean isError() {
        return severity == DiagnosticSeverity.ERROR;
    }
}
