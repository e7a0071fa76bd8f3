package com.ella.analyzer.services.bankstatements.parsers;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mapeamento campo canônico -> coluna da planilha. Só é construído completo (ver {@link ColumnMapper}).
 */
public final class ColumnMapping {

    public record ResolvedColumn(int index, String header) {
    }

    private final Map<StatementField, ResolvedColumn> columns;

    ColumnMapping(EnumMap<StatementField, ResolvedColumn> columns) {
        for (StatementField field : StatementField.values()) {
            if (!columns.containsKey(field)) {
                throw new IllegalStateException("Column mapping is missing " + field);
            }
        }
        this.columns = Collections.unmodifiableMap(new EnumMap<>(columns));
    }

    public int index(StatementField field) {
        return columns.get(field).index();
    }

    public String header(StatementField field) {
        return columns.get(field).header();
    }

    public Map<StatementField, ResolvedColumn> asMap() {
        return columns;
    }
}
