package com.ella.analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "analyzer.ingestion")
public record IngestionProperties(
        int headerScanLimit,
        int minHeaderCells,
        String bankLabel
) {
    public IngestionProperties {
        if (headerScanLimit <= 0) {
            headerScanLimit = 40;
        }
        if (minHeaderCells <= 0) {
            minHeaderCells = 4;
        }
        if (bankLabel == null || bankLabel.isBlank()) {
            bankLabel = "State Bank of India";
        }
    }

    public static IngestionProperties defaults() {
        return new IngestionProperties(0, 0, null);
    }
}
