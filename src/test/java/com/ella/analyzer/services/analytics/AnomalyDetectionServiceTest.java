package com.ella.analyzer.services.analytics;

import static com.ella.analyzer.services.analytics.TestTransactions.credit;
import static com.ella.analyzer.services.analytics.TestTransactions.debit;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ella.analyzer.config.AnomalyDetectionProperties;
import com.ella.analyzer.dto.analytics.Anomaly;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.AnomalySeverity;
import com.ella.analyzer.enums.AnomalyType;

@DisplayName("AnomalyDetectionService - valores altos, duplicados e picos")
class AnomalyDetectionServiceTest {

    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyDetectionService(AnomalyDetectionProperties.defaults());
    }

    @Test
    void amountAboveThreeTimesMerchantAverage_isFlagged() {
        LocalDate d = LocalDate.of(2024, 1, 1);
        List<Transaction> txs = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            txs.add(debit(d.plusDays(i), "UPI/DR/" + i + "/GROCER/x", "100", "1"));
        }
        Transaction big = debit(d.plusDays(10), "UPI/DR/9/GROCER/x", "2000", "1");
        txs.add(big);

        List<Anomaly> anomalies = service.detectHighAmounts(txs);

        assertEquals(1, anomalies.size());
        assertSame(big, anomalies.get(0).transaction());
        assertEquals(AnomalyType.HIGH_AMOUNT, anomalies.get(0).type());
        // 2000 / 480 = 4.17
        assertEquals(AnomalySeverity.MEDIUM, anomalies.get(0).severity());
        assertTrue(anomalies.get(0).description().startsWith("Transaction amount (₹2000.00) is 4x higher than average for Grocer"));
    }

    @Test
    void amountBelowRatio_isNotFlagged() {
        LocalDate d = LocalDate.of(2024, 1, 1);
        List<Transaction> txs = List.of(
                debit(d, "UPI/DR/1/GROCER/x", "100", "1"),
                debit(d.plusDays(1), "UPI/DR/2/GROCER/x", "100", "1"),
                debit(d.plusDays(2), "UPI/DR/3/GROCER/x", "250", "1"));

        assertTrue(service.detectHighAmounts(txs).isEmpty());
    }

    @Test
    void singleTransactionMerchant_isNeverHighAmount() {
        assertTrue(service.detectHighAmounts(List.of(
                debit(LocalDate.of(2024, 1, 1), "UPI/DR/1/JEWELLER/x", "90000", "1"))).isEmpty());
    }

    @Test
    void sameAmountMerchantAndDay_formDuplicateGroup() {
        LocalDate d = LocalDate.of(2024, 1, 3);
        Transaction a = debit(d, "UPI/DR/1/CAFE/x", "150.00", "1");
        Transaction b = debit(d, "UPI/DR/2/CAFE/y", "150", "1");
        Transaction c = debit(d, "UPI/DR/3/CAFE/z", "150.0", "1");

        List<List<Transaction>> groups = service.detectDuplicateGroups(List.of(a, b, c));
        List<Anomaly> anomalies = service.detectDuplicates(List.of(a, b, c));

        assertEquals(1, groups.size());
        assertEquals(3, groups.get(0).size());
        assertEquals(3, anomalies.size());
        assertTrue(anomalies.stream().allMatch(x -> x.severity() == AnomalySeverity.MEDIUM));
        assertEquals("Potential duplicate transaction: 3 transactions with same amount, merchant, and date",
                anomalies.get(0).description());
    }

    @Test
    void changingAnyKeyComponent_removesTransactionFromGroup() {
        LocalDate d = LocalDate.of(2024, 1, 3);
        Transaction a = debit(d, "UPI/DR/1/CAFE/x", "150", "1");
        Transaction b = debit(d, "UPI/DR/2/CAFE/x", "150", "1");
        Transaction otherDay = debit(d.plusDays(1), "UPI/DR/3/CAFE/x", "150", "1");
        Transaction otherAmount = debit(d, "UPI/DR/4/CAFE/x", "150.01", "1");
        Transaction otherMerchant = debit(d, "UPI/DR/5/BAKERY/x", "150", "1");

        List<List<Transaction>> groups = service.detectDuplicateGroups(List.of(a, b, otherDay, otherAmount, otherMerchant));

        assertEquals(1, groups.size());
        assertEquals(List.of(a, b), groups.get(0));
    }

    @Test
    void creditsAreIgnored() {
        LocalDate d = LocalDate.of(2024, 1, 3);
        List<Transaction> txs = List.of(
                credit(d, "UPI/CR/1/FRIEND/x", "500", "1"),
                credit(d, "UPI/CR/2/FRIEND/x", "500", "1"));

        assertTrue(service.detect(txs).isEmpty());
    }

    @Test
    void dayAboveTwiceTheDailyAverage_isSpike() {
        LocalDate d = LocalDate.of(2024, 2, 1);
        List<Transaction> txs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            txs.add(debit(d.plusDays(i), "POS SHOP " + i, "100", "1"));
        }
        Transaction spikeA = debit(d.plusDays(5), "POS TV STORE", "700", "1");
        Transaction spikeB = debit(d.plusDays(5), "POS CABLES", "300", "1");
        txs.add(spikeA);
        txs.add(spikeB);

        List<Anomaly> spikes = service.detectSpendingSpikes(txs);

        // média diária = (500 + 1000) / 6 = 250; limite 500
        assertEquals(2, spikes.size());
        assertEquals(AnomalyType.SPENDING_SPIKE, spikes.get(0).type());
        assertEquals(AnomalySeverity.MEDIUM, spikes.get(0).severity());
        assertSame(spikeA, spikes.get(0).transaction());
    }

    @Test
    void severity_bands() {
        assertEquals(AnomalySeverity.HIGH, service.severity(new BigDecimal("5.01")));
        assertEquals(AnomalySeverity.MEDIUM, service.severity(new BigDecimal("5")));
        assertEquals(AnomalySeverity.LOW, service.severity(new BigDecimal("3")));
    }
}
