package com.ella.analyzer.services.bankstatements;

/**
 * Falha do decoder de planilha. A mensagem já é a que vai para o usuário.
 */
public class SpreadsheetDecodingException extends IllegalArgumentException {

    public enum Reason {
        EMPTY_FILE,
        NO_PASSWORD,
        INVALID_PASSWORD,
        CORRUPTED_FILE,
        READ_ERROR,
        UNKNOWN_ERROR
    }

    private final Reason reason;

    public SpreadsheetDecodingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SpreadsheetDecodingException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
