package com.ella.analyzer.classification.dto;

import java.util.List;

public record CategorizationResult(String transactionId, List<TagMatch> matchedTags, boolean manualOverride) {

    public CategorizationResult {
        matchedTags = matchedTags == null ? List.of() : List.copyOf(matchedTags);
    }

    public List<String> tagIds() {
        return matchedTags.stream().map(TagMatch::tagId).distinct().toList();
    }
}
