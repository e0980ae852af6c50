package com.factorbot.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunContextTest {

    @Test
    void windowStart_shouldSpanBackfillYearsBeforeRunDate() {
        RunContext context = new RunContext("run_1", LocalDate.of(2024, 3, 31), MetricFrequency.MONTHLY, 5, List.of());

        assertEquals(LocalDate.of(2024, 3, 31).minusDays(1826), context.windowStart());
        assertEquals(context.windowStart().minusDays(370), context.dataStart(370));
    }

    @Test
    void universe_shouldBeNormalizedAndEmptyMeansAll() {
        RunContext scoped = new RunContext(null, LocalDate.of(2024, 3, 31), null, 0,
                Arrays.asList(" aapl", "AAPL", null, "msft"));
        RunContext all = new RunContext(null, LocalDate.of(2024, 3, 31), null, 1, null);

        assertEquals(List.of("AAPL", "MSFT"), scoped.universe);
        assertTrue(scoped.inUniverse("aapl"));
        assertFalse(scoped.inUniverse("IBM"));
        assertTrue(all.inUniverse("IBM"));
        assertEquals(1, scoped.backfillYears);
        assertEquals(MetricFrequency.MONTHLY, scoped.frequency);
        assertTrue(scoped.runId.startsWith("run_20240331_"));
    }

    @Test
    void flagsText_shouldBeEmptyForCleanRow() {
        FactorObservation row = new FactorObservation("AAA", LocalDate.of(2024, 3, 31), "pb_ratio", 1.0, null, null, null, null);

        assertEquals("", row.flagsText());
        assertEquals(MetricFrequency.UNKNOWN, row.frequency);
        assertTrue(row.withValue(2.0, QualityFlag.CAPPED).hasFlag(QualityFlag.CAPPED));
    }
}
