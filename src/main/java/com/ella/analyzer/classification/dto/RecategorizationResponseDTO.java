package com.ella.analyzer.classification.dto;

public record RecategorizationResponseDTO(int totalTransactions, int tagged, int untagged, int manualOverrides) {
}
