package com.ella.analyzer.dto.forecast;

import java.time.LocalDate;

import com.ella.analyzer.enums.ForecastWarningSeverity;
import com.ella.analyzer.enums.ForecastWarningType;

public record ForecastWarning(ForecastWarningType type, LocalDate date, String message, ForecastWarningSeverity severity) {
}
