package com.ella.analyzer.services.bankstatements.parsers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class AmountParserTest {

    @Test
    void stripsThousandsSeparators() {
        assertEquals(new BigDecimal("12345.60"), AmountParser.parse("12,345.6"));
    }

    @Test
    void numericCells_areScaledToCents() {
        assertEquals(new BigDecimal("500.00"), AmountParser.parse(500.0));
        assertEquals(new BigDecimal("0.10"), AmountParser.parse(0.1));
    }

    @Test
    void blankOrDash_meansAbsent() {
        assertNull(AmountParser.parse(null));
        assertNull(AmountParser.parse(""));
        assertNull(AmountParser.parse("  "));
        assertNull(AmountParser.parse("-"));
        assertNull(AmountParser.parse("n/a"));
    }

    @Test
    void zero_isNotAbsent() {
        assertEquals(new BigDecimal("0.00"), AmountParser.parse("0.00"));
    }

    @Test
    void drCrSuffix_readsLeadingNumber() {
        assertEquals(new BigDecimal("1500.00"), AmountParser.parse("1,500.00 CR"));
        assertEquals(new BigDecimal("500.00"), AmountParser.parse("500.00 Dr"));
        assertEquals(new BigDecimal("-42.50"), AmountParser.parse("-42.5CR"));
    }

    @Test
    void textWithoutLeadingNumber_isAbsent() {
        assertNull(AmountParser.parse("CR 500.00"));
        assertNull(AmountParser.parse("abc"));
    }
}
