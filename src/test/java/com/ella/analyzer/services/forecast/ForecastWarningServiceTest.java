package com.ella.analyzer.services.forecast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.analyzer.config.ForecastProperties;
import com.ella.analyzer.dto.forecast.BalanceForecast;
import com.ella.analyzer.dto.forecast.ConfidenceInterval;
import com.ella.analyzer.dto.forecast.ForecastWarning;
import com.ella.analyzer.enums.ForecastWarningSeverity;
import com.ella.analyzer.enums.ForecastWarningType;

@DisplayName("ForecastWarningService - avisos de saldo")
class ForecastWarningServiceTest {

    private final ForecastWarningService service = new ForecastWarningService(ForecastProperties.defaults());

    private static BalanceForecast forecast(String predicted, String low, String high) {
        return new BalanceForecast(LocalDate.of(2024, 1, 31), new BigDecimal(predicted),
                new ConfidenceInterval(new BigDecimal(low), new BigDecimal(high)), List.of());
    }

    @Test
    void negativePrediction_isCritical() {
        List<ForecastWarning> warnings = service.generateWarnings(List.of(forecast("-10.00", "-500.00", "480.00")));

        assertEquals(1, warnings.size());
        assertEquals(ForecastWarningType.NEGATIVE_BALANCE, warnings.get(0).type());
        assertEquals(ForecastWarningSeverity.CRITICAL, warnings.get(0).severity());
        assertEquals("Account balance is predicted to go negative (₹-10.00) by 2024-01-31", warnings.get(0).message());
    }

    @Test
    void belowThreshold_isLowBalanceWarning() {
        List<ForecastWarning> warnings = service.generateWarnings(List.of(forecast("999.99", "-50.00", "2000.00")));

        assertEquals(ForecastWarningType.LOW_BALANCE, warnings.get(0).type());
        assertEquals(ForecastWarningSeverity.WARNING, warnings.get(0).severity());
    }

    @Test
    void negativeWorstCase_isRiskWarning() {
        List<ForecastWarning> warnings = service.generateWarnings(List.of(forecast("1500.00", "-1.00", "3001.00")));

        assertEquals(1, warnings.size());
        assertEquals(ForecastWarningType.NEGATIVE_BALANCE, warnings.get(0).type());
        assertEquals(ForecastWarningSeverity.WARNING, warnings.get(0).severity());
    }

    @Test
    void healthyForecast_hasNoWarnings() {
        assertTrue(service.generateWarnings(List.of(forecast("5000.00", "4000.00", "6000.00"))).isEmpty());
    }

    @Test
    void customThreshold_isRespected() {
        assertTrue(service.generateWarnings(List.of(forecast("500.00", "400.00", "600.00")), new BigDecimal("100")).isEmpty());
    }
}
