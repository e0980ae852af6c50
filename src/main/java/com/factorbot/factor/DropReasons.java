package com.factorbot.factor;

/**
 * Reason labels attached to dropped candidates; they key the quality report counters.
 */
public final class DropReasons {
    public static final String PRICE_UNUSABLE = "price_unusable";
    public static final String INPUT_MISSING = "input_missing";
    public static final String DEBT_MISSING = "debt_missing";
    public static final String REVENUE_NON_POSITIVE = "revenue_non_positive";
    public static final String EQUITY_NON_POSITIVE = "equity_non_positive";
    public static final String SHARES_UNUSABLE = "shares_unusable";
    public static final String DATA_EXPIRED = "data_expired";
    public static final String INSUFFICIENT_HISTORY = "insufficient_history";

    private DropReasons() {
    }
}
