package com.ella.analyzer.classification.rules;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.ella.analyzer.entities.Tag;

public final class DefaultTagTemplates {

    private DefaultTagTemplates() {}

    public record TagTemplate(String name, List<String> keywords, String color, String icon) {
        public TagTemplate {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
            if (keywords == null || keywords.isEmpty()) throw new IllegalArgumentException("keywords are required");
            if (color == null || color.isBlank()) throw new IllegalArgumentException("color is required");
            keywords = List.copyOf(keywords);
        }
    }

    /**
     * Tags criadas na primeira abertura do store. Keywords em minúsculas; a ordem define qual keyword é
     * registrada quando mais de uma casa.
     */
    public static final List<TagTemplate> TEMPLATES;

    /**
     * Paleta usada para tags novas sem cor informada.
     */
    public static final List<String> TAG_COLORS = List.of(
            "#ef4444", "#f97316", "#f59e0b", "#eab308", "#84cc16", "#10b981", "#14b8a6",
            "#06b6d4", "#3b82f6", "#6366f1", "#8b5cf6", "#a855f7", "#ec4899", "#f43f5e"
    );

    static {
        List<TagTemplate> items = new ArrayList<>();

        items.add(new TagTemplate("Food & Delivery", List.of(
                "swiggy", "zomato", "uber eats", "dominos", "pizza", "mcdonald", "kfc", "burger",
                "restaurant", "food", "cafe", "coffee", "starbucks"), "#ef4444", "🍔"));

        items.add(new TagTemplate("Shopping", List.of(
                "amazon", "flipkart", "myntra", "ajio", "meesho", "shopping", "retail", "store", "mall",
                "supermarket", "grocery", "bigbasket", "blinkit", "zepto"), "#8b5cf6", "🛒"));

        items.add(new TagTemplate("Utilities", List.of(
                "electricity", "water", "gas", "internet", "broadband", "mobile", "recharge", "bill",
                "utility", "airtel", "jio", "vodafone", "bsnl"), "#3b82f6", "💡"));

        items.add(new TagTemplate("Investments", List.of(
                "mutual fund", "sip", "stock", "zerodha", "groww", "upstox", "investment", "trading",
                "equity", "gold", "bond", "fd", "fixed deposit"), "#10b981", "📈"));

        items.add(new TagTemplate("EMI & Loans", List.of(
                "emi", "loan", "credit card", "installment", "repayment", "hdfc", "icici", "sbi", "axis",
                "kotak", "mortgage", "personal loan", "home loan"), "#f59e0b", "💳"));

        items.add(new TagTemplate("ATM Withdrawals", List.of(
                "atm", "cash withdrawal", "cwd", "withdrawal", "cash"), "#6366f1", "🏧"));

        items.add(new TagTemplate("Refunds", List.of(
                "refund", "reversal", "cashback", "return", "credit", "reimbursement"), "#14b8a6", "↩️"));

        items.add(new TagTemplate("Insurance", List.of(
                "insurance", "premium", "policy", "lic", "health insurance", "life insurance",
                "car insurance", "term insurance"), "#ec4899", "🛡️"));

        items.add(new TagTemplate("Entertainment", List.of(
                "netflix", "prime video", "hotstar", "spotify", "youtube", "movie", "cinema", "pvr", "inox",
                "entertainment", "subscription", "gaming"), "#f97316", "🎬"));

        items.add(new TagTemplate("Transportation", List.of(
                "uber", "ola", "rapido", "metro", "bus", "train", "taxi", "fuel", "petrol", "diesel",
                "parking", "toll"), "#06b6d4", "🚗"));

        items.add(new TagTemplate("Healthcare", List.of(
                "hospital", "doctor", "pharmacy", "medicine", "medical", "health", "clinic", "apollo",
                "fortis", "max", "diagnostic", "lab"), "#dc2626", "🏥"));

        TEMPLATES = Collections.unmodifiableList(items);
    }

    /**
     * Instancia os templates como tags padrão, com ids estáveis tag-1..tag-N.
     */
    public static List<Tag> toTags(LocalDateTime now) {
        List<Tag> tags = new ArrayList<>(TEMPLATES.size());
        for (int i = 0; i < TEMPLATES.size(); i++) {
            TagTemplate t = TEMPLATES.get(i);
            tags.add(Tag.builder()
                    .id("tag-" + (i + 1))
                    .name(t.name())
                    .keywords(new ArrayList<>(t.keywords()))
                    .color(t.color())
                    .icon(t.icon())
                    .defaultTag(true)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }
        return tags;
    }
}
