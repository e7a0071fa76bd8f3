package com.ella.analyzer.services.bankstatements.parsers;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

import org.springframework.stereotype.Component;

import com.ella.analyzer.services.bankstatements.parsers.ColumnMapping.ResolvedColumn;

@Component
public class ColumnMapper {

    /**
     * Resolve todos os campos canônicos contra a linha de cabeçalho.
     * Aliases são comparados por igualdade após normalização; referência ainda tenta "ref"/"cheque" como substring.
     *
     * @throws ColumnMappingException com todos os campos não resolvidos
     */
    public ColumnMapping map(List<Object> headerRow) {
        List<String> normalized = new ArrayList<>();
        for (Object cell : headerRow) {
            normalized.add(CellValues.normalizeHeader(cell));
        }

        EnumMap<StatementField, ResolvedColumn> resolved = new EnumMap<>(StatementField.class);
        List<StatementField> missing = new ArrayList<>();

        for (StatementField field : StatementField.values()) {
            int index = findByAlias(field, normalized);
            if (index < 0 && field == StatementField.REF_NO) {
                index = findReferenceFallback(normalized);
            }
            if (index < 0) {
                missing.add(field);
            } else {
                resolved.put(field, new ResolvedColumn(index, CellValues.text(headerRow.get(index))));
            }
        }

        if (!missing.isEmpty()) {
            throw new ColumnMappingException(missing);
        }
        return new ColumnMapping(resolved);
    }

    private int findByAlias(StatementField field, List<String> headers) {
        for (String alias : field.getAliases()) {
            String normalizedAlias = CellValues.normalizeHeader(alias);
            int index = headers.indexOf(normalizedAlias);
            if (index >= 0) {
                return index;
            }
        }
        return -1;
    }

    private int findReferenceFallback(List<String> headers) {
        for (int i = 0; i < headers.size(); i++) {
            String h = headers.get(i);
            if (!h.isEmpty() && (h.contains("ref") || h.contains("cheque"))) {
                return i;
            }
        }
        return -1;
    }
}
