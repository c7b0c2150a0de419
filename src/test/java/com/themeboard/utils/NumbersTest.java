package com.themeboard.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class NumbersTest {

    @Test
    void parse_shouldBeLenientWithDecorations() {
        assertEquals(1234.0, Numbers.parse("1,234"));
        assertEquals(3.5, Numbers.parse("+3.5%"));
        assertEquals(-2.1, Numbers.parse("-2.1%"));
        assertEquals(12345.0, Numbers.parse("12,345억"));
        assertNull(Numbers.parse("-"));
        assertNull(Numbers.parse(""));
    }

    @Test
    void parsePlain_shouldOnlyStripCommas() {
        assertEquals(1045470.0, Numbers.parsePlain("1,045,470"));
        assertNull(Numbers.parsePlain("12억"));
        assertNull(Numbers.parsePlain("N/A"));
        assertNull(Numbers.parsePlain(" "));
    }

    @Test
    void format_shouldUseSignedPercentAndIntegerPrices() {
        assertEquals("+10.00%", Numbers.formatPct(10.0));
        assertEquals("-3.33%", Numbers.formatPct(-3.333));
        assertEquals("+0.00%", Numbers.formatPct(0.0));
        assertEquals("110", Numbers.formatPrice(110.0));
        assertEquals("110.50", Numbers.formatPrice(110.5));
    }
}
