package com.ella.analyzer.services.forecast;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.ella.analyzer.config.ForecastProperties;
import com.ella.analyzer.dto.analytics.RecurringPayment;
import com.ella.analyzer.dto.forecast.CashFlowProjection;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.services.analytics.RecurringPaymentDetectionService;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class CashFlowProjectionService {

    private final RecurringPaymentDetectionService recurringDetectionService;
    private final ForecastProperties properties;
    private final Clock clock;

    /**
     * Uma projeção para cada janela configurada (30/60/90 dias por padrão) que caiba no horizonte pedido.
     */
    public List<CashFlowProjection> project(List<Transaction> transactions, int horizonDays) {
        if (transactions == null || transactions.isEmpty() || horizonDays <= 0) {
            return List.of();
        }

        ForecastMath.DailyAverages averages = ForecastMath.dailyAverages(transactions);
        List<RecurringPayment> recurring = recurringDetectionService.detect(transactions);
        LocalDate today = LocalDate.now(clock);

        List<CashFlowProjection> out = new ArrayList<>();
        for (int periodDays : properties.projectionPeriods()) {
            if (periodDays > horizonDays) {
                continue;
            }
            LocalDate end = today.plusDays(periodDays);
            BigDecimal days = BigDecimal.valueOf(periodDays);
            List<RecurringPayment> due = ForecastMath.dueBetween(recurring, today, end);
            BigDecimal recurringTotal = ForecastMath.totalAmount(due);

            BigDecimal inflow = ForecastMath.money(averages.income().multiply(days));
            BigDecimal outflow = ForecastMath.money(averages.expense().multiply(days).add(recurringTotal));
            out.add(new CashFlowProjection(periodDays + " days", periodDays, end,
                    inflow, outflow, inflow.subtract(outflow), due));
        }
        return out;
    }
}
