package com.largomodo.bayalloc.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputNamingTest {

    @Test
    void testSingleMonth() {
        List<LocalDate> dates = List.of(LocalDate.of(2025, 7, 1), LocalDate.of(2025, 7, 31));

        assertEquals("Full_Jul-2025_512-picks", OutputNaming.describe(dates, 512));
    }

    @Test
    void testMonthRangeUsesYearOfLatestDate() {
        List<LocalDate> dates = List.of(LocalDate.of(2025, 12, 9), LocalDate.of(2025, 8, 2),
                LocalDate.of(2026, 1, 3));

        assertEquals("Full_Aug-Jan-2026_100K-picks", OutputNaming.describe(dates, 100_000));
    }

    @Test
    void testNoDates() {
        assertEquals("Full__0-picks", OutputNaming.describe(Arrays.asList((LocalDate) null), 0));
    }

    @Test
    void testFormatCount() {
        assertEquals("999", OutputNaming.formatCount(999));
        assertEquals("1K", OutputNaming.formatCount(1000));
        assertEquals("1K", OutputNaming.formatCount(1499));
        assertEquals("2K", OutputNaming.formatCount(1500));
    }
}
