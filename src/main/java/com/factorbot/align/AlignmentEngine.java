package com.factorbot.align;

import com.factorbot.model.AtomicObservation;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * As-of resolution of metrics onto requested dates.
 *
 * <p>Values are carried forward as a step function; nothing is interpolated.
 * Staleness verdicts belong to the quality rules, which read
 * {@link AlignedValue#ageDays}.</p>
 */
public final class AlignmentEngine {
    private final int priceFallbackTradingDays;
    private final int maxLookbackDays;

    public AlignmentEngine(int priceFallbackTradingDays, int maxLookbackDays) {
        this.priceFallbackTradingDays = Math.max(0, priceFallbackTradingDays);
        this.maxLookbackDays = Math.max(1, maxLookbackDays);
    }

    /**
     * Last observation with reference date on or before {@code asOf}, unavailable
     * when none exists within the maximum lookback.
     */
    public AlignedValue asOf(EntityTimeline timeline, String metricName, LocalDate asOf) {
        List<AtomicObservation> history = timeline.history(metricName, asOf);
        if (history.isEmpty()) {
            return AlignedValue.unavailable();
        }
        AtomicObservation last = history.get(history.size() - 1);
        long age = ChronoUnit.DAYS.between(last.referenceDate(), asOf);
        if (age > maxLookbackDays) {
            return AlignedValue.unavailable();
        }
        return AlignedValue.of(last.value, last.referenceDate(), last.observationDate, age, 0);
    }

    /**
     * Strict backward price lookup: the exact date, otherwise the latest earlier
     * price no more than the fallback window of trading days away.
     */
    public AlignedValue priceAsOf(EntityTimeline timeline, String metricName, LocalDate asOf) {
        List<AtomicObservation> history = timeline.history(metricName, asOf);
        if (history.isEmpty()) {
            return AlignedValue.unavailable();
        }
        AtomicObservation last = history.get(history.size() - 1);
        int lag = TradingCalendar.tradingDaysBetween(last.referenceDate(), asOf);
        if (lag > priceFallbackTradingDays) {
            return AlignedValue.unavailable();
        }
        long age = ChronoUnit.DAYS.between(last.referenceDate(), asOf);
        return AlignedValue.of(last.value, last.referenceDate(), last.observationDate, age, lag);
    }

    /**
     * Sum of non-null values with reference date in {@code (fromExclusive, toInclusive]}.
     * Zero when nothing was reported in the window.
     */
    public double sumWindow(EntityTimeline timeline, String metricName, LocalDate fromExclusive, LocalDate toInclusive) {
        double sum = 0.0;
        for (AtomicObservation observation : timeline.history(metricName, toInclusive)) {
            if (observation.referenceDate().isAfter(fromExclusive) && observation.value != null) {
                sum += observation.value;
            }
        }
        return sum;
    }
}
