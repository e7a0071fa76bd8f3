package com.ella.analyzer.services.bankstatements.parsers;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Datas de extrato: serial do Excel, ISO (2024-01-31), "01 Jan 2024" / "01-Jan-2024" e 31/01/2024 (dia primeiro).
 * Datas de calendário inválidas (31/02) retornam null.
 */
public final class StatementDateParser {

    // 1900-01-01 menos 2 dias: compensa o 29/02/1900 inexistente que o Excel conta
    static final LocalDate EXCEL_EPOCH = LocalDate.of(1899, 12, 30);

    private static final Pattern ISO = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern DAY_MONTH_NAME_YEAR =
            Pattern.compile("(\\d{1,2})[\\s\\-]([a-z]{3,9})[\\s\\-](\\d{4})", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{4})");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12)
    );

    private StatementDateParser() {
    }

    public static LocalDate parse(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return fromExcelSerial(n.doubleValue());
        }

        String s = value.toString().trim();
        if (s.isEmpty()) {
            return null;
        }

        Matcher iso = ISO.matcher(s);
        if (iso.find()) {
            return safeDate(iso.group(1), iso.group(2), iso.group(3));
        }

        Matcher named = DAY_MONTH_NAME_YEAR.matcher(s);
        if (named.find()) {
            Integer month = MONTHS.get(named.group(2).substring(0, 3).toLowerCase(Locale.ROOT));
            if (month != null) {
                return safeDate(named.group(3), String.valueOf(month), named.group(1));
            }
        }

        Matcher dmy = DAY_MONTH_YEAR.matcher(s);
        if (dmy.find()) {
            return safeDate(dmy.group(3), dmy.group(2), dmy.group(1));
        }

        return null;
    }

    static LocalDate fromExcelSerial(double serial) {
        if (Double.isNaN(serial) || Double.isInfinite(serial) || serial < 1) {
            return null;
        }
        return EXCEL_EPOCH.plusDays((long) Math.floor(serial));
    }

    private static LocalDate safeDate(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }
}
