package com.factorbot.factor;

import com.factorbot.rolling.PriceWindow;

public final class MomentumRule extends PriceWindowRule {
    public static final String NAME = "momentum_1m";

    @Override
    public String factorName() {
        return NAME;
    }

    @Override
    protected Double statistic(PriceWindow window) {
        return window.momentum();
    }
}
