package com.ella.analyzer.services.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.ella.analyzer.classification.rules.MerchantExtractor;
import com.ella.analyzer.config.RecurringDetectionProperties;
import com.ella.analyzer.dto.analytics.RecurringPayment;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.enums.RecurringCategory;
import com.ella.analyzer.enums.RecurringFrequency;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Detecta pagamentos recorrentes: débitos agrupados por comerciante, valores próximos da média
 * do grupo e intervalo médio dentro de uma das faixas de {@link RecurringFrequency}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringPaymentDetectionService {

    private static final List<String> SUBSCRIPTION_HINTS = List.of("netflix", "spotify", "prime", "subscription", "membership");
    private static final List<String> LOAN_HINTS = List.of("emi", "loan", "finance", "bajaj");
    private static final List<String> UTILITY_HINTS = List.of("electric", "water", "gas", "internet", "mobile", "broadband", "utility");

    private final RecurringDetectionProperties properties;

    public List<RecurringPayment> detect(List<Transaction> transactions) {
        List<Transaction> debits = AnalyticsUtils.debits(transactions);
        if (debits.size() < properties.minOccurrences()) {
            return List.of();
        }

        Map<String, List<Transaction>> byMerchant = new LinkedHashMap<>();
        for (Transaction t : debits) {
            byMerchant.computeIfAbsent(MerchantExtractor.merchantKey(t.getDetails()), k -> new ArrayList<>()).add(t);
        }

        List<RecurringPayment> out = new ArrayList<>();
        for (Map.Entry<String, List<Transaction>> entry : byMerchant.entrySet()) {
            if (entry.getValue().size() < properties.minOccurrences()) {
                continue;
            }
            analyzeGroup(entry.getKey(), entry.getValue()).ifPresent(out::add);
        }

        out.sort(Comparator.comparingInt(RecurringPayment::confidence).reversed()
                .thenComparing(RecurringPayment::merchant));
        log.debug("[RecurringDetection] debits={} merchants={} recurring={}", debits.size(), byMerchant.size(), out.size());
        return out;
    }

    Optional<RecurringPayment> analyzeGroup(String merchant, List<Transaction> group) {
        List<Transaction> sorted = new ArrayList<>(group);
        sorted.sort(Comparator.comparing(Transaction::getDate));

        BigDecimal mean = mean(sorted);
        if (mean.signum() <= 0) {
            return Optional.empty();
        }

        // mantém só quem está dentro da tolerância em torno da média do grupo inteiro
        BigDecimal maxDiff = mean.multiply(properties.amountTolerance());
        List<Transaction> similar = sorted.stream()
                .filter(t -> AnalyticsUtils.safeDebit(t).subtract(mean).abs().compareTo(maxDiff) <= 0)
                .toList();
        if (similar.size() < properties.minOccurrences()) {
            return Optional.empty();
        }

        List<Long> intervals = new ArrayList<>();
        for (int i = 1; i < similar.size(); i++) {
            intervals.add(ChronoUnit.DAYS.between(similar.get(i - 1).getDate(), similar.get(i).getDate()));
        }
        double averageInterval = intervals.stream().mapToLong(Long::longValue).average().orElse(0);

        Optional<RecurringFrequency> frequency = RecurringFrequency.fromAverageInterval(averageInterval);
        if (frequency.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal amount = mean(similar).setScale(AnalyticsUtils.MONEY_SCALE, RoundingMode.HALF_UP);
        Transaction last = similar.get(similar.size() - 1);

        return Optional.of(new RecurringPayment(
                merchant,
                amount,
                frequency.get(),
                last.getDate(),
                last.getDate().plusDays(frequency.get().getPeriodDays()),
                categorize(merchant, amount),
                confidence(intervals, frequency.get()),
                similar.size()
        ));
    }

    /**
     * 100 menos o desvio médio dos intervalos em relação ao período ideal, normalizado por uma fração do período.
     */
    int confidence(List<Long> intervals, RecurringFrequency frequency) {
        if (intervals.isEmpty()) {
            return 0;
        }
        double avgDeviation = intervals.stream()
                .mapToDouble(i -> Math.abs(i - frequency.getPeriodDays()))
                .average()
                .orElse(0);
        double divisor = frequency.getPeriodDays() * properties.confidenceDivisorRatio().doubleValue();
        double raw = 100 - (avgDeviation / divisor) * 100;
        return (int) Math.round(Math.max(0, Math.min(100, raw)));
    }

    RecurringCategory categorize(String merchant, BigDecimal amount) {
        String lower = merchant == null ? "" : merchant.toLowerCase(Locale.ROOT);
        if (containsAny(lower, SUBSCRIPTION_HINTS)) {
            return RecurringCategory.SUBSCRIPTION;
        }
        if (containsAny(lower, LOAN_HINTS)) {
            return RecurringCategory.LOAN;
        }
        if (containsAny(lower, UTILITY_HINTS)) {
            return RecurringCategory.UTILITY;
        }
        if (amount != null && amount.compareTo(properties.loanAmountThreshold()) > 0) {
            return RecurringCategory.LOAN;
        }
        return RecurringCategory.OTHER;
    }

    private static boolean containsAny(String text, List<String> hints) {
        for (String h : hints) {
            if (text.contains(h)) {
                return true;
            }
        }
        return false;
    }

    private static BigDecimal mean(List<Transaction> transactions) {
        BigDecimal total = BigDecimal.ZERO;
        for (Transaction t : transactions) {
            total = total.add(AnalyticsUtils.safeDebit(t));
        }
        return total.divide(BigDecimal.valueOf(transactions.size()), 6, RoundingMode.HALF_UP);
    }
}
