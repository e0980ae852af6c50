package com.factorbot.factor;

import com.factorbot.rolling.PriceWindow;

/**
 * Sample standard deviation of trailing simple daily returns.
 */
public final class VolatilityRule extends PriceWindowRule {
    public static final String NAME = "volatility_20d";

    @Override
    public String factorName() {
        return NAME;
    }

    @Override
    protected Double statistic(PriceWindow window) {
        return window.volatility();
    }
}
