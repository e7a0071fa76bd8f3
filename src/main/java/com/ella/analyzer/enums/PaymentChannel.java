package com.ella.analyzer.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canal de pagamento detectado a partir da narrativa.
 * A ordem de declaração é a ordem de avaliação: o primeiro padrão que casar vence.
 */
public enum PaymentChannel {
    INSTANT_TRANSFER("Instant transfer", "UPI", "UNIFIED PAYMENT"),
    WIRE("Wire transfer", "NEFT", "NATIONAL ELECTRONIC"),
    IMMEDIATE_TRANSFER("Immediate transfer", "IMPS", "IMMEDIATE PAYMENT"),
    ATM("ATM", "ATM", "CASH WITHDRAWAL", "\\bCWD\\b"),
    POINT_OF_SALE("Point of sale", "POS", "POINT OF SALE", "CARD PURCHASE"),
    CHEQUE("Cheque", "CHEQUE", "\\bCHQ\\b", "CHECK", "CLEARING", "\\bCLG\\b"),
    OTHER("Other");

    private final String displayName;
    private final List<Pattern> patterns;

    PaymentChannel(String displayName, String... regexes) {
        this.displayName = displayName;
        this.patterns = Arrays.stream(regexes).map(Pattern::compile).toList();
    }

    public String getDisplayName() {
        return displayName;
    }

    public static PaymentChannel classify(String narrative) {
        if (narrative == null || narrative.isBlank()) {
            return OTHER;
        }
        String upper = narrative.toUpperCase(Locale.ROOT);
        for (PaymentChannel channel : values()) {
            for (Pattern p : channel.patterns) {
                if (p.matcher(upper).find()) {
                    return channel;
                }
            }
        }
        return OTHER;
    }
}
