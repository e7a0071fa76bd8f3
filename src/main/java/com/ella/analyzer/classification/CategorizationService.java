package com.ella.analyzer.classification;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.ella.analyzer.classification.dto.CategorizationResult;
import com.ella.analyzer.classification.dto.RecategorizationResponseDTO;
import com.ella.analyzer.classification.dto.TagMatch;
import com.ella.analyzer.classification.dto.TagStatistics;
import com.ella.analyzer.classification.rules.MerchantExtractor;
import com.ella.analyzer.config.CategorizationProperties;
import com.ella.analyzer.entities.Tag;
import com.ella.analyzer.entities.Transaction;
import com.ella.analyzer.repositories.TagStore;
import com.ella.analyzer.repositories.TransactionStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Categorização determinística por keywords.
 * <p>
 * Transações com manualTagOverride nunca têm tagIds alterados. A recategorização recalcula os tagIds do zero
 * e publica a coleção inteira de uma vez.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategorizationService {

    private static final Pattern NON_ALPHANUMERIC_LOWER = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    static final int MAX_ABBREVIATION_GAP = 2;

    private final TransactionStore transactionStore;
    private final TagStore tagStore;
    private final CategorizationProperties properties;

    public CategorizationResult categorize(Transaction transaction, List<Tag> tags) {
        String details = lower(transaction.getDetails());
        List<String> abbreviations = abbreviationTokens(transaction.getDetails());

        Map<String, TagMatch> byTag = new LinkedHashMap<>();
        List<Tag> unmatched = new ArrayList<>();
        for (Tag tag : safe(tags)) {
            TagMatch direct = directMatch(tag, details);
            if (direct != null) {
                byTag.put(tag.getId(), direct);
            } else {
                unmatched.add(tag);
            }
        }
        // abreviação: token da narrativa que é a keyword truncada (ex.: "swigg" -> "swiggy")
        for (TagMatch abbreviated : matchKeywordsToTags(abbreviations, unmatched)) {
            String token = abbreviations.get(abbreviated.matchPosition());
            byTag.put(abbreviated.tagId(), new TagMatch(abbreviated.tagId(), abbreviated.keyword(), details.indexOf(token)));
        }

        List<TagMatch> matches = new ArrayList<>();
        for (Tag tag : safe(tags)) {
            TagMatch match = byTag.get(tag.getId());
            if (match != null) {
                matches.add(match);
            }
        }
        return new CategorizationResult(transaction.getId(), matches, transaction.isManualTagOverride());
    }

    public Map<String, CategorizationResult> categorizeAll(List<Transaction> transactions, List<Tag> tags) {
        Map<String, CategorizationResult> results = new LinkedHashMap<>();
        for (Transaction t : safe(transactions)) {
            results.put(t.getId(), categorize(t, tags));
        }
        return results;
    }

    /**
     * Devolve uma nova lista com cópias das transações recategorizadas; a lista de entrada não é alterada.
     */
    public List<Transaction> applyResults(List<Transaction> transactions, Map<String, CategorizationResult> results) {
        List<Transaction> out = new ArrayList<>(safe(transactions).size());
        for (Transaction t : safe(transactions)) {
            CategorizationResult result = results.get(t.getId());
            if (result == null || t.isManualTagOverride()) {
                out.add(t);
                continue;
            }
            out.add(t.toBuilder().tagIds(new ArrayList<>(result.tagIds())).build());
        }
        return out;
    }

    public List<Transaction> recategorize(List<Transaction> transactions, List<Tag> tags) {
        return applyResults(transactions, categorizeAll(transactions, tags));
    }

    public RecategorizationResponseDTO recategorizeStoredTransactions() {
        // recalcula e publica sob o lock do store: uma edição manual concorrente não é sobrescrita
        List<Transaction> updated = transactionStore.update(current -> recategorize(current, tagStore.findAll()));

        int overrides = (int) updated.stream().filter(Transaction::isManualTagOverride).count();
        int untagged = findUntagged(updated).size();
        int tagged = (int) updated.stream().filter(t -> !tagIdsOf(t).isEmpty()).count();
        log.info("[Categorization] recategorized total={} tagged={} untagged={} manualOverrides={}",
                updated.size(), tagged, untagged, overrides);
        return new RecategorizationResponseDTO(updated.size(), tagged, untagged, overrides);
    }

    /**
     * Casamento entre keywords já extraídas e as keywords das tags: a keyword extraída contém a da tag, ou é
     * uma abreviação dela (prefixo a no máximo {@value #MAX_ABBREVIATION_GAP} letras do fim). Cada tag casa
     * no máximo uma vez; matchPosition é o índice da keyword extraída.
     */
    public List<TagMatch> matchKeywordsToTags(List<String> keywords, List<Tag> tags) {
        List<TagMatch> matches = new ArrayList<>();
        List<String> safeKeywords = safe(keywords);
        for (Tag tag : safe(tags)) {
            TagMatch match = firstKeywordMatch(tag, safeKeywords);
            if (match != null) {
                matches.add(match);
            }
        }
        return matches;
    }

    static boolean isAbbreviationOf(String token, String keyword) {
        return keyword.startsWith(token) && keyword.length() - token.length() <= MAX_ABBREVIATION_GAP;
    }

    private TagMatch firstKeywordMatch(Tag tag, List<String> keywords) {
        for (String tagKeyword : safe(tag.getKeywords())) {
            String tk = lower(tagKeyword).trim();
            if (tk.isEmpty()) {
                continue;
            }
            for (int i = 0; i < keywords.size(); i++) {
                String k = lower(keywords.get(i)).trim();
                if (!k.isEmpty() && (k.contains(tk) || isAbbreviationOf(k, tk))) {
                    return new TagMatch(tag.getId(), tagKeyword, i);
                }
            }
        }
        return null;
    }

    public List<Transaction> findByTag(List<Transaction> transactions, String tagId) {
        return safe(transactions).stream().filter(t -> tagIdsOf(t).contains(tagId)).toList();
    }

    public List<Transaction> findByTags(List<Transaction> transactions, List<String> tagIds) {
        Set<String> wanted = new HashSet<>(safe(tagIds));
        return safe(transactions).stream()
                .filter(t -> tagIdsOf(t).stream().anyMatch(wanted::contains))
                .toList();
    }

    public List<Transaction> findUntagged(List<Transaction> transactions) {
        return safe(transactions).stream()
                .filter(t -> !t.isManualTagOverride() && tagIdsOf(t).isEmpty())
                .toList();
    }

    public Map<String, TagStatistics> tagStatistics(List<Transaction> transactions, List<Tag> tags) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (Transaction t : safe(transactions)) {
            BigDecimal amount = t.getAmount() == null ? BigDecimal.ZERO : t.getAmount();
            for (String tagId : tagIdsOf(t)) {
                counts.merge(tagId, 1, Integer::sum);
                totals.merge(tagId, amount, BigDecimal::add);
            }
        }

        Map<String, TagStatistics> stats = new LinkedHashMap<>();
        for (Tag tag : safe(tags)) {
            stats.put(tag.getId(), new TagStatistics(tag,
                    counts.getOrDefault(tag.getId(), 0),
                    totals.getOrDefault(tag.getId(), BigDecimal.ZERO)));
        }
        return stats;
    }

    public List<String> suggestKeywords(List<Transaction> transactions, Tag tag) {
        return suggestKeywords(transactions, tag, properties.suggestionMinFrequency());
    }

    /**
     * Palavras frequentes nas transações da tag que ainda não são keywords dela, da mais para a menos frequente.
     */
    public List<String> suggestKeywords(List<Transaction> transactions, Tag tag, int minFrequency) {
        List<Transaction> tagged = findByTag(transactions, tag.getId());
        if (tagged.isEmpty()) {
            return List.of();
        }

        Set<String> existing = new HashSet<>();
        for (String k : safe(tag.getKeywords())) {
            existing.add(lower(k));
        }

        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (Transaction t : tagged) {
            String cleaned = NON_ALPHANUMERIC_LOWER.matcher(lower(t.getDetails())).replaceAll(" ");
            for (String word : WHITESPACE.split(cleaned.trim())) {
                if (word.length() > 2 && !existing.contains(word)) {
                    frequency.merge(word, 1, Integer::sum);
                }
            }
        }

        return frequency.entrySet().stream()
                .filter(e -> e.getValue() >= minFrequency)
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private TagMatch directMatch(Tag tag, String details) {
        for (String keyword : safe(tag.getKeywords())) {
            String kw = lower(keyword).trim();
            if (kw.isEmpty()) {
                continue;
            }
            int position = details.indexOf(kw);
            if (position >= 0) {
                return new TagMatch(tag.getId(), keyword, position);
            }
        }
        return null;
    }

    private List<String> abbreviationTokens(String details) {
        List<String> tokens = new ArrayList<>();
        for (String k : MerchantExtractor.extractKeywords(details)) {
            String lower = lower(k);
            if (lower.length() >= properties.minAbbreviationLength() && !lower.contains(" ")) {
                tokens.add(lower);
            }
        }
        return tokens;
    }

    private static List<String> tagIdsOf(Transaction t) {
        return t.getTagIds() == null ? List.of() : t.getTagIds();
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    private static <T> List<T> safe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
