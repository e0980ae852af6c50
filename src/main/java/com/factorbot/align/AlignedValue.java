package com.factorbot.align;

import java.time.LocalDate;

/**
 * The effective value of one metric for one as-of date, with its age at use.
 * An unavailable value is an alignment gap, not an error.
 */
public final class AlignedValue {
    private static final AlignedValue UNAVAILABLE = new AlignedValue(false, null, null, null, 0L, 0);

    public final boolean available;
    public final Double value;
    public final LocalDate referenceDate;
    public final LocalDate observationDate;
    public final long ageDays;
    public final int lagTradingDays;

    private AlignedValue(
            boolean available,
            Double value,
            LocalDate referenceDate,
            LocalDate observationDate,
            long ageDays,
            int lagTradingDays
    ) {
        this.available = available;
        this.value = value;
        this.referenceDate = referenceDate;
        this.observationDate = observationDate;
        this.ageDays = ageDays;
        this.lagTradingDays = lagTradingDays;
    }

    public static AlignedValue unavailable() {
        return UNAVAILABLE;
    }

    public static AlignedValue of(Double value, LocalDate referenceDate, LocalDate observationDate, long ageDays, int lagTradingDays) {
        return new AlignedValue(true, value, referenceDate, observationDate, Math.max(0L, ageDays), Math.max(0, lagTradingDays));
    }

    /**
     * Available and carrying a non-null number.
     */
    public boolean usable() {
        return available && value != null;
    }

    public boolean positive() {
        return usable() && value > 0.0;
    }

    @Override
    public String toString() {
        return available ? value + "@" + referenceDate + "(age=" + ageDays + "d)" : "unavailable";
    }
}
