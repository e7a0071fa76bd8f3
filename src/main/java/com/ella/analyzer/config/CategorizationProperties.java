package com.ella.analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ajustes do matcher de categorias.
 * minAbbreviationLength: tamanho mínimo de um token da narrativa para casar por abreviação
 * (token contido na keyword da tag).
 */
@ConfigurationProperties(prefix = "analyzer.categorization")
public record CategorizationProperties(
        int minAbbreviationLength,
        int suggestionMinFrequency
) {
    public CategorizationProperties {
        if (minAbbreviationLength <= 0) {
            minAbbreviationLength = 4;
        }
        if (suggestionMinFrequency <= 0) {
            suggestionMinFrequency = 2;
        }
    }

    public static CategorizationProperties defaults() {
        return new CategorizationProperties(0, 0);
    }
}
