package com.factorbot.align;

import com.factorbot.model.AtomicObservation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Positive closes of one price metric, one per trading day, oldest first.
 * Several records on the same day collapse to the last one.
 */
public final class CloseSeries {
    private final LocalDate[] dates;
    private final double[] closes;

    private CloseSeries(LocalDate[] dates, double[] closes) {
        this.dates = dates;
        this.closes = closes;
    }

    static CloseSeries of(List<AtomicObservation> history) {
        List<LocalDate> dates = new ArrayList<>();
        List<Double> closes = new ArrayList<>();
        for (AtomicObservation observation : history) {
            if (observation.value == null || observation.value <= 0.0) {
                continue;
            }
            LocalDate day = observation.referenceDate();
            if (!dates.isEmpty() && dates.get(dates.size() - 1).equals(day)) {
                closes.set(closes.size() - 1, observation.value);
                continue;
            }
            dates.add(day);
            closes.add(observation.value);
        }
        double[] values = new double[closes.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = closes.get(i);
        }
        return new CloseSeries(dates.toArray(new LocalDate[0]), values);
    }

    /**
     * Number of closes dated on or before {@code asOf}; indexes below it are readable for that as-of date.
     */
    public int countUpTo(LocalDate asOf) {
        int lo = 0;
        int hi = dates.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (dates[mid].isAfter(asOf)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    public LocalDate date(int index) {
        return dates[index];
    }

    public double close(int index) {
        return closes[index];
    }

    public int size() {
        return closes.length;
    }
}
