package com.bmsedge.forecast.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateFormatsTest {

    @Test
    @DisplayName("Day-first spellings are preferred")
    void testDayFirst() {
        assertEquals(LocalDate.of(2025, 4, 7), DateFormats.parse("07/04/2025"));
        assertEquals(LocalDate.of(2025, 4, 7), DateFormats.parse("7/4/2025"));
        assertEquals(LocalDate.of(2021, 7, 7), DateFormats.parse("7/7/21"));
        assertEquals(LocalDate.of(2025, 4, 7), DateFormats.parse("07-04-2025"));
    }

    @Test
    @DisplayName("Dashed dates without zero padding parse with two- or four-digit years")
    void testUnpaddedDashes() {
        assertEquals(LocalDate.of(2021, 7, 7), DateFormats.parse("7-7-21"));
        assertEquals(LocalDate.of(2025, 4, 7), DateFormats.parse("7-4-2025"));
        assertEquals(LocalDate.of(2025, 12, 15), DateFormats.parse("15-12-25"));
    }

    @Test
    @DisplayName("ISO dates parse with or without a time part")
    void testIso() {
        assertEquals(LocalDate.of(2025, 4, 5), DateFormats.parse("2025-04-05"));
        assertEquals(LocalDate.of(2025, 4, 5), DateFormats.parse("2025-04-05 10:31:00"));
        assertEquals(LocalDate.of(2025, 4, 5), DateFormats.parse("2025-04-05T10:31"));
    }

    @Test
    @DisplayName("Month-first is used only when day-first cannot apply")
    void testMonthFirstFallback() {
        assertEquals(LocalDate.of(2025, 4, 25), DateFormats.parse("04/25/2025"));
    }

    @Test
    @DisplayName("Unparseable values give null")
    void testInvalid() {
        assertNull(DateFormats.parse(null));
        assertNull(DateFormats.parse("  "));
        assertNull(DateFormats.parse("Total"));
        assertNull(DateFormats.parse("Croissant"));
    }
}
