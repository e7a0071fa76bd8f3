package com.ella.analyzer.services.bankstatements.parsers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class CellValues {

    private static final Pattern MULTISPACE = Pattern.compile("\\s+");

    private CellValues() {
    }

    public static Object cell(List<Object> row, int index) {
        if (row == null || index < 0 || index >= row.size()) {
            return null;
        }
        return row.get(index);
    }

    /**
     * Texto da célula. Números inteiros saem sem ".0" (referências numéricas, por exemplo).
     */
    public static String text(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return "";
            }
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return String.valueOf(d.longValue());
            }
            return BigDecimal.valueOf(d).toPlainString();
        }
        return value.toString().trim();
    }

    public static String normalizeHeader(Object value) {
        return MULTISPACE.matcher(text(value).toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    public static boolean isBlankRow(List<Object> row) {
        if (row == null || row.isEmpty()) {
            return true;
        }
        for (Object cell : row) {
            if (!text(cell).isBlank()) {
                return false;
            }
        }
        return true;
    }
}
