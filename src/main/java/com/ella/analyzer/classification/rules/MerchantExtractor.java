package com.ella.analyzer.classification.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extração de comerciante e keywords a partir da narrativa do extrato.
 * <p>
 * Regras em lista ordenada (a primeira que casar vence): formatos de UPI, depois NEFT/IMPS,
 * e por fim as primeiras palavras significativas da narrativa. Identificar o comerciante errado
 * numa narrativa malformada é aceitável; não é erro.
 */
public final class MerchantExtractor {

    private MerchantExtractor() {}

    private static final List<Pattern> UPI_PATTERNS = List.of(
            // UPI/DR/ref/MERCHANT/vpa
            Pattern.compile("UPI/(?:DR|CR)/[^/]+/([^/]+)/[^/]+", Pattern.CASE_INSENSITIVE),
            // UPI-MERCHANT-123
            Pattern.compile("UPI-([^-]+)-\\d+", Pattern.CASE_INSENSITIVE),
            // UPI/MERCHANT/ref
            Pattern.compile("UPI/([^/]+)/[^/]+", Pattern.CASE_INSENSITIVE),
            // UPI MERCHANT 123
            Pattern.compile("UPI\\s+([A-Z][A-Z0-9\\s]+?)\\s+\\d+", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> TRANSFER_PATTERNS = List.of(
            Pattern.compile("(?:NEFT|IMPS)-([^-]+)-[^-]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:NEFT|IMPS)/[^/]+/([^/]+)", Pattern.CASE_INSENSITIVE)
    );

    public static final Set<String> STOP_WORDS = Set.of(
            "UPI", "NEFT", "IMPS", "ATM", "POS", "PAYMENT", "TRANSFER", "TO", "FROM", "REF", "REFERENCE",
            "NO", "NUMBER", "DR", "CR", "DEBIT", "CREDIT", "TRANSACTION", "TXN", "ID"
    );

    private static final Pattern NON_MERCHANT_CHARS = Pattern.compile("[^a-zA-Z0-9\\s-]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final int FALLBACK_WORDS = 3;
    private static final int MERCHANT_KEY_FALLBACK_LENGTH = 20;

    public static Optional<String> extractMerchantName(String details) {
        if (details == null || details.isBlank()) {
            return Optional.empty();
        }

        Optional<String> structured = structuredMerchant(details);
        if (structured.isPresent()) {
            return structured;
        }

        List<String> words = significantWords(details);
        if (words.isEmpty()) {
            return Optional.empty();
        }
        List<String> head = words.subList(0, Math.min(FALLBACK_WORDS, words.size()));
        return Optional.of(String.join(" ", head.stream().map(MerchantExtractor::titleCase).toList()));
    }

    /**
     * Chave de agrupamento por comerciante usada pelos detectores. Nunca vazia para narrativa não vazia.
     */
    public static String merchantKey(String details) {
        if (details == null) {
            return "";
        }
        return extractMerchantName(details).orElseGet(() -> {
            String trimmed = details.trim();
            return trimmed.length() <= MERCHANT_KEY_FALLBACK_LENGTH
                    ? trimmed
                    : trimmed.substring(0, MERCHANT_KEY_FALLBACK_LENGTH);
        });
    }

    /**
     * Comerciante estruturado (se houver), suas palavras e as palavras significativas da narrativa,
     * em title case e sem repetição.
     */
    public static List<String> extractKeywords(String details) {
        if (details == null || details.isBlank()) {
            return List.of();
        }

        Set<String> keywords = new LinkedHashSet<>();
        structuredMerchant(details).ifPresent(merchant -> {
            keywords.add(merchant);
            for (String w : WHITESPACE.split(merchant)) {
                if (w.length() > 2) {
                    keywords.add(w);
                }
            }
        });
        for (String w : significantWords(details)) {
            keywords.add(titleCase(w));
        }
        return new ArrayList<>(keywords);
    }

    public static boolean containsKeyword(String details, String keyword) {
        if (details == null || keyword == null || details.isEmpty() || keyword.isEmpty()) {
            return false;
        }
        return details.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT));
    }

    public static List<String> extractAllWords(String details) {
        if (details == null || details.isBlank()) {
            return List.of();
        }
        Set<String> words = new LinkedHashSet<>();
        for (String w : WHITESPACE.split(NON_ALPHANUMERIC.matcher(details).replaceAll(" "))) {
            String lower = w.trim().toLowerCase(Locale.ROOT);
            if (!lower.isEmpty()) {
                words.add(lower);
            }
        }
        return new ArrayList<>(words);
    }

    static String cleanMerchantName(String raw) {
        String cleaned = NON_MERCHANT_CHARS.matcher(raw).replaceAll(" ");
        List<String> kept = new ArrayList<>();
        for (String w : WHITESPACE.split(cleaned.trim())) {
            if (!w.isEmpty() && !STOP_WORDS.contains(w.toUpperCase(Locale.ROOT))) {
                kept.add(titleCase(w));
            }
        }
        return String.join(" ", kept).trim();
    }

    private static Optional<String> structuredMerchant(String details) {
        String upper = details.toUpperCase(Locale.ROOT);
        if (upper.contains("UPI")) {
            Optional<String> m = firstMatch(UPI_PATTERNS, details);
            if (m.isPresent()) {
                return m;
            }
        }
        if (upper.contains("NEFT") || upper.contains("IMPS")) {
            return firstMatch(TRANSFER_PATTERNS, details);
        }
        return Optional.empty();
    }

    private static Optional<String> firstMatch(List<Pattern> patterns, String details) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(details);
            if (m.find() && m.group(1) != null) {
                String cleaned = cleanMerchantName(m.group(1));
                if (!cleaned.isEmpty()) {
                    return Optional.of(cleaned);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> significantWords(String details) {
        return Arrays.stream(WHITESPACE.split(NON_ALPHANUMERIC.matcher(details).replaceAll(" ")))
                .map(String::trim)
                .filter(w -> w.length() > 2)
                .filter(w -> !STOP_WORDS.contains(w.toUpperCase(Locale.ROOT)))
                .toList();
    }

    private static String titleCase(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
