package com.factorbot.rolling;

import java.time.LocalDate;

/**
 * Trading-day window statistics anchored on the last price at or before an as-of date.
 *
 * @param anchorDate  date of the anchor price, null when there is no price
 * @param returnCount daily returns available up to the anchor
 * @param momentum    anchor / price {@code window} trading days earlier - 1, null when history is short
 * @param volatility  sample standard deviation of the trailing simple returns, null when history is short
 */
public record PriceWindow(LocalDate anchorDate, int returnCount, Double momentum, Double volatility) {

    public static PriceWindow empty() {
        return new PriceWindow(null, 0, null, null);
    }
}
