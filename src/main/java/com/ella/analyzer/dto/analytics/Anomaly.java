package com.ella.analyzer.dto.analytics;

import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.AnomalySeverity;
import com.ella.analyzer.enums.AnomalyType;

public record Anomaly(Transaction transaction, AnomalyType type, AnomalySeverity severity, String description) {
}
