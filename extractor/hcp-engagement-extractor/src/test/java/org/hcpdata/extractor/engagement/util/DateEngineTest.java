package org.hcpdata.extractor.engagement.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.hcpdata.extractor.engagement.exception.DateFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class DateEngineTest {

    private static final LocalDate MARCH_5 = LocalDate.of(2024, 3, 5);

    @ParameterizedTest
    @ValueSource(strings = {
        "2024-03-05",
        "2024/03/05",
        "20240305",
        "3/5/2024",
        "03/05/2024",
        "2024-03-05 14:22:01",
        "2024-03-05T14:22",
        "2024-03-05T14:22:01.123",
        "3/5/2024 9:15",
        "  2024-03-05  "
    })
    void testParseDate_acceptedFormats(String raw) throws DateFormatException {
        assertEquals(MARCH_5, DateEngine.parseDate(raw));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "not-a-date", "2024-02-30", "13/01/2024", "2024-3-5", "2024-03-05 noon"})
    void testParseDate_rejected(String raw) {
        DateFormatException e = assertThrows(DateFormatException.class, () -> DateEngine.parseDate(raw));
        assertEquals(raw, e.getRawValue());
    }

    @Test
    void testToYrmo_leapYearAndYearBoundary() throws DateFormatException {
        assertEquals("2024-02", DateEngine.toYrmo(DateEngine.parseDate("2024-02-29")));
        assertEquals("2023-12", DateEngine.toYrmo(DateEngine.parseDate("12/31/2023")));
        assertEquals("2024-01", DateEngine.toYrmo(DateEngine.parseDate("20240101")));
        assertEquals("0999-07", DateEngine.toYrmo(LocalDate.of(999, 7, 4)));
    }

    @Test
    void testToYrmo_roundTripsThroughFirstOfMonth() throws DateFormatException {
        for (LocalDate date : List.of(LocalDate.of(2024, 2, 29), LocalDate.of(2023, 12, 31), LocalDate.of(2024, 1, 1))) {
            String yrmo = DateEngine.toYrmo(date);
            assertEquals(yrmo, DateEngine.toYrmo(DateEngine.parseDate(yrmo + "-01")));
        }
    }

    @Test
    void testRetention_sevenMonthsFromOctober() {
        LocalDate reference = LocalDate.of(2024, 10, 18);

        assertEquals(LocalDate.of(2024, 3, 1), DateEngine.retentionCutoff(7, reference));
        assertFalse(DateEngine.withinRetention(LocalDate.of(2024, 2, 29), 7, reference), "February is eight months back");
        assertTrue(DateEngine.withinRetention(LocalDate.of(2024, 3, 1), 7, reference), "Cutoff day is retained");
        assertTrue(DateEngine.withinRetention(LocalDate.of(2024, 3, 31), 7, reference));
    }

    @Test
    void testRetention_zeroMonthsKeepsReferenceMonthAndFuture() {
        LocalDate reference = LocalDate.of(2024, 10, 18);

        assertEquals(LocalDate.of(2024, 10, 1), DateEngine.retentionCutoff(0, reference));
        assertFalse(DateEngine.withinRetention(LocalDate.of(2024, 9, 30), 0, reference));
        assertTrue(DateEngine.withinRetention(LocalDate.of(2030, 1, 1), 0, reference), "No upper bound");
    }

    @Test
    void testRetention_crossesYearBoundary() {
        assertEquals(LocalDate.of(2024, 12, 1), DateEngine.retentionCutoff(1, LocalDate.of(2025, 1, 31)));
        assertEquals(LocalDate.of(2023, 10, 1), DateEngine.retentionCutoff(12, LocalDate.of(2024, 10, 31)));
    }

    @Test
    void testRetention_matchesCalendarMonthArithmetic() {
        LocalDate reference = LocalDate.of(2024, 10, 18);
        for (int months : List.of(0, 1, 7, 12)) {
            YearMonth firstRetained = YearMonth.from(reference).minusMonths(months);
            for (LocalDate date = LocalDate.of(2021, 1, 1); date.isBefore(LocalDate.of(2026, 1, 1)); date = date.plusDays(5)) {
                boolean expected = YearMonth.from(date).compareTo(firstRetained) >= 0;
                assertEquals(expected, DateEngine.withinRetention(date, months, reference),
                    "months=" + months + " date=" + date);
            }
        }
    }

    @Test
    void testRetention_negativeMonthsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DateEngine.retentionCutoff(-1, LocalDate.of(2024, 10, 18)));
    }
}
