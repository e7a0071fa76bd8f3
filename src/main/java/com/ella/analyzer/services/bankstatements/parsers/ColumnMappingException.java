package com.ella.analyzer.services.bankstatements.parsers;

import java.util.List;
import java.util.stream.Collectors;

public class ColumnMappingException extends IllegalArgumentException {

    private final List<StatementField> missingFields;

    public ColumnMappingException(List<StatementField> missingFields) {
        super("Could not detect required columns. Expected: Date, Details, Ref No, Debit, Credit, Balance. Missing: "
                + missingFields.stream().map(StatementField::getLabel).collect(Collectors.joining(", ")));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<StatementField> getMissingFields() {
        return missingFields;
    }
}
