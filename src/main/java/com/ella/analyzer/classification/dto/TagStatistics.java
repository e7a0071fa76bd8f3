package com.ella.analyzer.classification.dto;

import java.math.BigDecimal;

import com.ella.analyzer.entities.Tag;

public record TagStatistics(Tag tag, int count, BigDecimal totalAmount) {
}
