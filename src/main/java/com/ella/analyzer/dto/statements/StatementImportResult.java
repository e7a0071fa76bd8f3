package com.ella.analyzer.dto.statements;

/**
 * merge é null quando a importação falhou e nada foi gravado.
 */
public record StatementImportResult(StatementParseResult parse, MergeResult merge) {

    public boolean imported() {
        return parse.success() && merge != null;
    }
}
