package com.ella.analyzer.classification.dto;

/**
 * matchPosition: índice da keyword na narrativa em minúsculas (ou no vetor de keywords extraídas).
 */
public record TagMatch(String tagId, String keyword, int matchPosition) {
}
