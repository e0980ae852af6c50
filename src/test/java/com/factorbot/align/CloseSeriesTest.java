package com.factorbot.align;

import com.factorbot.factor.Metrics;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.factorbot.ObservationFixtures.price;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class CloseSeriesTest {

    @Test
    void closeSeries_shouldKeepLastCloseOfDayAndSkipNonPositive() {
        EntityTimeline timeline = EntityTimeline.of("AAA", List.of(
                price("AAA", LocalDate.of(2024, 1, 2), 10.0),
                price("AAA", LocalDate.of(2024, 1, 3), 11.0),
                price("AAA", LocalDate.of(2024, 1, 3), 12.0),
                price("AAA", LocalDate.of(2024, 1, 4), 0.0),
                price("AAA", LocalDate.of(2024, 1, 5), 13.0)
        ));

        CloseSeries series = timeline.closeSeries(Metrics.ADJUSTED_CLOSE_PRICE);

        assertEquals(3, series.size());
        assertEquals(12.0, series.close(1), 1e-12);
        assertEquals(LocalDate.of(2024, 1, 5), series.date(2));
        assertSame(series, timeline.closeSeries(Metrics.ADJUSTED_CLOSE_PRICE));
    }

    @Test
    void countUpTo_shouldExcludeClosesAfterAsOf() {
        EntityTimeline timeline = EntityTimeline.of("AAA", List.of(
                price("AAA", LocalDate.of(2024, 1, 2), 10.0),
                price("AAA", LocalDate.of(2024, 1, 3), 11.0),
                price("AAA", LocalDate.of(2024, 1, 8), 12.0)
        ));
        CloseSeries series = timeline.closeSeries(Metrics.ADJUSTED_CLOSE_PRICE);

        assertEquals(0, series.countUpTo(LocalDate.of(2024, 1, 1)));
        assertEquals(2, series.countUpTo(LocalDate.of(2024, 1, 7)));
        assertEquals(3, series.countUpTo(LocalDate.of(2024, 1, 8)));
        assertEquals(0, timeline.closeSeries("missing_metric").size());
    }
}
