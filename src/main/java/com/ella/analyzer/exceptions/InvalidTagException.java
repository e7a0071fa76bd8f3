package com.ella.analyzer.exceptions;

import java.util.List;

/**
 * Tag rejeitada pela validação (nome ausente/longo, keywords vazias).
 */
public class InvalidTagException extends IllegalArgumentException {

    private final List<String> errors;

    public InvalidTagException(List<String> errors) {
        super("Invalid tag: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
