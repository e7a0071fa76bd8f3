package com.ella.analyzer.services.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.ella.analyzer.classification.rules.MerchantExtractor;
import com.ella.analyzer.config.AnomalyDetectionProperties;
import com.ella.analyzer.dto.analytics.Anomaly;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.AnomalySeverity;
import com.ella.analyzer.enums.AnomalyType;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Três passadas independentes sobre os débitos: valor alto por comerciante, duplicatas e picos diários.
 * Uma mesma transação pode aparecer em mais de uma categoria.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetectionService {

    private static final int RATIO_SCALE = 6;

    private final AnomalyDetectionProperties properties;

    public List<Anomaly> detect(List<Transaction> transactions) {
        List<Transaction> debits = AnalyticsUtils.debits(transactions);
        if (debits.isEmpty()) {
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        anomalies.addAll(detectHighAmounts(debits));
        anomalies.addAll(detectDuplicates(debits));
        anomalies.addAll(detectSpendingSpikes(debits));

        log.debug("[AnomalyDetection] debits={} anomalies={}", debits.size(), anomalies.size());
        return anomalies;
    }

    public List<Anomaly> detectHighAmounts(List<Transaction> transactions) {
        Map<String, List<Transaction>> byMerchant = new LinkedHashMap<>();
        for (Transaction t : AnalyticsUtils.debits(transactions)) {
            byMerchant.computeIfAbsent(MerchantExtractor.merchantKey(t.getDetails()), k -> new ArrayList<>()).add(t);
        }

        List<Anomaly> out = new ArrayList<>();
        for (Map.Entry<String, List<Transaction>> entry : byMerchant.entrySet()) {
            List<Transaction> group = entry.getValue();
            if (group.size() < properties.minMerchantGroupSize()) {
                continue;
            }

            BigDecimal total = AnalyticsUtils.sum(group.stream().map(AnalyticsUtils::safeDebit).toList());
            BigDecimal average = total.divide(BigDecimal.valueOf(group.size()), RATIO_SCALE, RoundingMode.HALF_UP);
            if (average.signum() <= 0) {
                continue;
            }
            BigDecimal threshold = average.multiply(properties.highAmountMultiplier());

            for (Transaction t : group) {
                BigDecimal amount = AnalyticsUtils.safeDebit(t);
                if (amount.compareTo(threshold) > 0) {
                    BigDecimal ratio = amount.divide(average, RATIO_SCALE, RoundingMode.HALF_UP);
                    out.add(new Anomaly(t, AnomalyType.HIGH_AMOUNT, severity(ratio),
                            "Transaction amount (" + AnalyticsUtils.formatCurrency(amount) + ") is "
                                    + ratio.setScale(0, RoundingMode.HALF_UP).toPlainString()
                                    + "x higher than average for " + entry.getKey()
                                    + " (" + AnalyticsUtils.formatCurrency(average) + ")"));
                }
            }
        }
        return out;
    }

    public List<Anomaly> detectDuplicates(List<Transaction> transactions) {
        List<Anomaly> out = new ArrayList<>();
        for (List<Transaction> group : detectDuplicateGroups(transactions)) {
            String description = "Potential duplicate transaction: " + group.size()
                    + " transactions with same amount, merchant, and date";
            for (Transaction t : group) {
                out.add(new Anomaly(t, AnomalyType.DUPLICATE, AnomalySeverity.MEDIUM, description));
            }
        }
        return out;
    }

    /**
     * Grupos (tamanho >= 2) de débitos com mesmo valor, comerciante extraído e dia.
     */
    public List<List<Transaction>> detectDuplicateGroups(List<Transaction> transactions) {
        Map<String, List<Transaction>> groups = new LinkedHashMap<>();
        for (Transaction t : AnalyticsUtils.debits(transactions)) {
            groups.computeIfAbsent(duplicateKey(t), k -> new ArrayList<>()).add(t);
        }
        return groups.values().stream().filter(g -> g.size() > 1).toList();
    }

    public List<Anomaly> detectSpendingSpikes(List<Transaction> transactions) {
        Map<LocalDate, List<Transaction>> byDay = new LinkedHashMap<>();
        Map<LocalDate, BigDecimal> dailyTotals = new LinkedHashMap<>();
        for (Transaction t : AnalyticsUtils.debits(transactions)) {
            byDay.computeIfAbsent(t.getDate(), k -> new ArrayList<>()).add(t);
            dailyTotals.merge(t.getDate(), AnalyticsUtils.safeDebit(t), BigDecimal::add);
        }
        if (dailyTotals.isEmpty()) {
            return List.of();
        }

        BigDecimal average = AnalyticsUtils.sum(new ArrayList<>(dailyTotals.values()))
                .divide(BigDecimal.valueOf(dailyTotals.size()), RATIO_SCALE, RoundingMode.HALF_UP);
        if (average.signum() <= 0) {
            return List.of();
        }
        BigDecimal threshold = average.multiply(properties.spikeMultiplier());

        List<Anomaly> out = new ArrayList<>();
        for (Map.Entry<LocalDate, BigDecimal> day : dailyTotals.entrySet()) {
            if (day.getValue().compareTo(threshold) <= 0) {
                continue;
            }
            BigDecimal ratio = day.getValue().divide(average, RATIO_SCALE, RoundingMode.HALF_UP);
            String description = "Daily spending (" + AnalyticsUtils.formatCurrency(day.getValue()) + ") is "
                    + ratio.setScale(0, RoundingMode.HALF_UP).toPlainString()
                    + "x higher than average (" + AnalyticsUtils.formatCurrency(average) + ")";
            for (Transaction t : byDay.get(day.getKey())) {
                out.add(new Anomaly(t, AnomalyType.SPENDING_SPIKE, severity(ratio), description));
            }
        }
        return out;
    }

    AnomalySeverity severity(BigDecimal ratio) {
        if (ratio.compareTo(properties.highSeverityMultiplier()) > 0) {
            return AnomalySeverity.HIGH;
        }
        if (ratio.compareTo(properties.highAmountMultiplier()) > 0) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }

    private String duplicateKey(Transaction t) {
        BigDecimal amount = AnalyticsUtils.safeDebit(t).setScale(properties.duplicateAmountScale(), RoundingMode.HALF_UP);
        return amount.toPlainString() + "|" + MerchantExtractor.merchantKey(t.getDetails()) + "|" + t.getDate();
    }
}
