package com.ella.analyzer.services.forecast;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.ella.analyzer.config.ForecastProperties;
import com.ella.analyzer.dto.forecast.BalanceForecast;
import com.ella.analyzer.dto.forecast.ForecastWarning;
import com.ella.analyzer.enums.ForecastWarningSeverity;
import com.ella.analyzer.enums.ForecastWarningType;
import com.ella.analyzer.services.analytics.AnalyticsUtils;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ForecastWarningService {

    private final ForecastProperties properties;

    public List<ForecastWarning> generateWarnings(List<BalanceForecast> forecasts) {
        return generateWarnings(forecasts, properties.lowBalanceThreshold());
    }

    /**
     * No máximo um aviso por previsão: saldo negativo (crítico), abaixo do piso, ou pior caso negativo.
     */
    public List<ForecastWarning> generateWarnings(List<BalanceForecast> forecasts, BigDecimal lowBalanceThreshold) {
        List<ForecastWarning> warnings = new ArrayList<>();
        if (forecasts == null) {
            return warnings;
        }
        for (BalanceForecast f : forecasts) {
            BigDecimal predicted = f.predictedBalance();
            if (predicted.signum() < 0) {
                warnings.add(new ForecastWarning(ForecastWarningType.NEGATIVE_BALANCE, f.date(),
                        "Account balance is predicted to go negative (" + AnalyticsUtils.formatCurrency(predicted)
                                + ") by " + f.date(),
                        ForecastWarningSeverity.CRITICAL));
            } else if (predicted.compareTo(lowBalanceThreshold) < 0) {
                warnings.add(new ForecastWarning(ForecastWarningType.LOW_BALANCE, f.date(),
                        "Account balance is predicted to fall below threshold (" + AnalyticsUtils.formatCurrency(predicted)
                                + ") by " + f.date(),
                        ForecastWarningSeverity.WARNING));
            } else if (f.confidenceInterval().low().signum() < 0) {
                warnings.add(new ForecastWarning(ForecastWarningType.NEGATIVE_BALANCE, f.date(),
                        "There is a risk of negative balance (worst case: "
                                + AnalyticsUtils.formatCurrency(f.confidenceInterval().low()) + ") by " + f.date(),
                        ForecastWarningSeverity.WARNING));
            }
        }
        return warnings;
    }
}
