package com.factorbot.align;

import com.factorbot.model.MetricFrequency;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * As-of dates on which factors are evaluated.
 */
public final class CalendarGrid {

    private CalendarGrid() {
    }

    public static List<LocalDate> monthEnds(LocalDate start, LocalDate end) {
        List<LocalDate> out = new ArrayList<>();
        if (start == null || end == null || end.isBefore(start)) {
            return out;
        }
        YearMonth cursor = YearMonth.from(start);
        YearMonth last = YearMonth.from(end);
        while (!cursor.isAfter(last)) {
            LocalDate monthEnd = cursor.atEndOfMonth();
            if (!monthEnd.isBefore(start) && !monthEnd.isAfter(end)) {
                out.add(monthEnd);
            }
            cursor = cursor.plusMonths(1);
        }
        return out;
    }

    public static List<LocalDate> quarterEnds(LocalDate start, LocalDate end) {
        List<LocalDate> out = new ArrayList<>();
        for (LocalDate monthEnd : monthEnds(start, end)) {
            if (monthEnd.getMonthValue() % 3 == 0) {
                out.add(monthEnd);
            }
        }
        return out;
    }

    /**
     * Trading dates taken from an entity's own price history, limited to the window.
     */
    public static List<LocalDate> tradingDates(Collection<LocalDate> priceDates, LocalDate start, LocalDate end) {
        TreeSet<LocalDate> out = new TreeSet<>();
        if (priceDates == null) {
            return new ArrayList<>();
        }
        for (LocalDate date : priceDates) {
            if (date != null && !date.isBefore(start) && !date.isAfter(end)) {
                out.add(date);
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * Period-end grid for a frequency, with the run date appended as the terminal
     * as-of point when requested and not already present.
     */
    public static List<LocalDate> periodEnds(MetricFrequency frequency, LocalDate start, LocalDate end, boolean includeEnd) {
        List<LocalDate> out;
        if (frequency == MetricFrequency.QUARTERLY) {
            out = quarterEnds(start, end);
        } else {
            out = monthEnds(start, end);
        }
        if (includeEnd && end != null && (out.isEmpty() || !out.get(out.size() - 1).equals(end))) {
            out.add(end);
        }
        return out;
    }
}
