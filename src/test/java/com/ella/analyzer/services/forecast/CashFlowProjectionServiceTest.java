package com.ella.analyzer.services.forecast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.analyzer.config.ForecastProperties;
import com.ella.analyzer.config.RecurringDetectionProperties;
import com.ella.analyzer.dto.forecast.CashFlowProjection;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.TransactionType;
import com.ella.analyzer.services.analytics.RecurringPaymentDetectionService;

@DisplayName("CashFlowProjectionService - projeção 30/60/90 dias")
class CashFlowProjectionServiceTest {

    private CashFlowProjectionService service;

    @BeforeEach
    void setUp() {
        service = new CashFlowProjectionService(
                new RecurringPaymentDetectionService(RecurringDetectionProperties.defaults()),
                ForecastProperties.defaults(),
                Clock.fixed(Instant.parse("2024-01-20T10:00:00Z"), ZoneOffset.UTC));
    }

    private static Transaction tx(String id, LocalDate date, TransactionType type, String details, String amount) {
        BigDecimal value = new BigDecimal(amount);
        return Transaction.builder()
                .id(id)
                .date(date)
                .details(details)
                .type(type)
                .amount(value)
                .credit(type == TransactionType.CREDIT ? value : null)
                .debit(type == TransactionType.DEBIT ? value : null)
                .balance(BigDecimal.ZERO)
                .build();
    }

    @Test
    void onlyWindowsInsideHorizonAreProjected() {
        List<Transaction> history = List.of(
                tx("1", LocalDate.of(2024, 1, 1), TransactionType.CREDIT, "NEFT-EMPLOYER-SAL", "3000"),
                tx("2", LocalDate.of(2024, 1, 11), TransactionType.DEBIT, "POS GROCERY", "1000"));

        List<CashFlowProjection> projections = service.project(history, 60);

        assertEquals(2, projections.size());
        CashFlowProjection first = projections.get(0);
        assertEquals("30 days", first.period());
        assertEquals(LocalDate.of(2024, 2, 19), first.endDate());
        assertEquals(new BigDecimal("9000.00"), first.expectedInflow());
        assertEquals(new BigDecimal("3000.00"), first.expectedOutflow());
        assertEquals(new BigDecimal("6000.00"), first.netFlow());
        assertEquals(60, projections.get(1).periodDays());
    }

    @Test
    void recurringPaymentsDueInWindow_addToOutflow() {
        List<Transaction> history = List.of(
                tx("n1", LocalDate.of(2023, 12, 1), TransactionType.DEBIT, "UPI/DR/401234/NETFLIX/x", "649"),
                tx("n2", LocalDate.of(2023, 12, 31), TransactionType.DEBIT, "UPI/DR/401234/NETFLIX/x", "649"));

        List<CashFlowProjection> projections = service.project(history, 90);

        assertEquals(3, projections.size());
        CashFlowProjection first = projections.get(0);
        assertEquals(1, first.recurringPayments().size());
        assertEquals(LocalDate.of(2024, 1, 30), first.recurringPayments().get(0).nextExpectedDate());
        // 1298 / 30 por dia * 30 + 649 do recorrente
        assertEquals(new BigDecimal("1947.00"), first.expectedOutflow());
    }

    @Test
    void emptyHistory_hasNoProjection() {
        assertTrue(service.project(List.of(), 90).isEmpty());
    }
}
