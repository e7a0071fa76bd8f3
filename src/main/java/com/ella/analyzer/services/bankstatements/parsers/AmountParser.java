package com.ella.analyzer.services.bankstatements.parsers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Valores monetários do extrato. Vazio, branco ou "-" significam ausência (null), nunca zero.
 * <p>
 * Textos são lidos pelo número inicial: "1,500.00 CR" vale 1500.00. Sem número no início, o valor é null.
 */
public final class AmountParser {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");

    private AmountParser() {
    }

    public static BigDecimal parse(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d).setScale(2, RoundingMode.HALF_UP);
        }

        String clean = value.toString().replace(",", "").trim();
        if (clean.isEmpty() || clean.equals("-")) {
            return null;
        }
        Matcher number = LEADING_NUMBER.matcher(clean);
        if (!number.find()) {
            return null;
        }
        return new BigDecimal(number.group()).setScale(2, RoundingMode.HALF_UP);
    }
}
