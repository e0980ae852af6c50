package com.factorbot.align;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Weekday trading calendar. Exchange holidays are not modelled.
 */
public final class TradingCalendar {

    private TradingCalendar() {
    }

    public static boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    /**
     * Number of trading days in {@code (from, to]}; zero when {@code to} is not after {@code from}.
     */
    public static int tradingDaysBetween(LocalDate from, LocalDate to) {
        if (from == null || to == null || !to.isAfter(from)) {
            return 0;
        }
        int count = 0;
        LocalDate cursor = from.plusDays(1);
        while (!cursor.isAfter(to)) {
            if (isTradingDay(cursor)) {
                count++;
            }
            cursor = cursor.plusDays(1);
        }
        return count;
    }
}
