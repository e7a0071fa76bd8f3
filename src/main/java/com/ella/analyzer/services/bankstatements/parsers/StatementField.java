package com.ella.analyzer.services.bankstatements.parsers;

import java.util.List;

/**
 * Campos canônicos de um extrato e os cabeçalhos aceitos para cada um, em ordem de preferência.
 */
public enum StatementField {
    DATE("Date", List.of("Date", "Txn Date", "Transaction Date", "Value Date")),
    DETAILS("Details", List.of("Details", "Description", "Narration", "Particulars")),
    REF_NO("Ref No", List.of("Ref No/Cheque No", "Ref No./Cheque No.", "Ref No", "Reference No", "Cheque No",
            "Transaction ID")),
    DEBIT("Debit", List.of("Debit", "Withdrawal", "Dr")),
    CREDIT("Credit", List.of("Credit", "Deposit", "Cr")),
    BALANCE("Balance", List.of("Balance", "Closing Balance", "Available Balance"));

    private final String label;
    private final List<String> aliases;

    StatementField(String label, List<String> aliases) {
        this.label = label;
        this.aliases = aliases;
    }

    public String getLabel() {
        return label;
    }

    public List<String> getAliases() {
        return aliases;
    }
}
