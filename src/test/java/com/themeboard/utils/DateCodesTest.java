package com.themeboard.utils;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DateCodesTest {

    @Test
    void toYyyymmdd_shouldPivotCenturyAtSeventy() {
        assertEquals("20240105", DateCodes.toYyyymmdd("240105"));
        assertEquals("20691231", DateCodes.toYyyymmdd("691231"));
        assertEquals("19700101", DateCodes.toYyyymmdd("700101"));
        assertEquals("", DateCodes.toYyyymmdd("2401"));
    }

    @Test
    void parseDay_shouldAcceptAllThreeShapes() {
        LocalDate expected = LocalDate.of(2024, 1, 5);
        assertEquals(expected, DateCodes.parseDay("240105"));
        assertEquals(expected, DateCodes.parseDay("20240105"));
        assertEquals(expected, DateCodes.parseDay("2024-01-05"));
        assertNull(DateCodes.parseDay("241305"));
        assertNull(DateCodes.parseDay("abc"));
        assertNull(DateCodes.parseDay(null));
    }

    @Test
    void formatDay_shouldRenderSixDigits() {
        assertEquals("240105", DateCodes.formatDay(LocalDate.of(2024, 1, 5)));
        assertEquals("", DateCodes.formatDay(null));
    }

    @Test
    void sortKey_shouldNormalizeBothWidths() {
        assertEquals("20240105", DateCodes.sortKey("240105"));
        assertEquals("20240105", DateCodes.sortKey("20240105"));
        assertEquals("", DateCodes.sortKey("soon"));
    }

    @Test
    void isDayCode_shouldRequireExactlySixDigits() {
        assertTrue(DateCodes.isDayCode("240105"));
        assertFalse(DateCodes.isDayCode("20240105"));
        assertFalse(DateCodes.isDayCode("24010a"));
    }
}
