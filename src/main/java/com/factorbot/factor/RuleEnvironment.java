package com.factorbot.factor;

import com.factorbot.align.AlignmentEngine;
import com.factorbot.config.EngineSettings;
import com.factorbot.quality.StalenessPolicy;
import com.factorbot.rolling.RollingAggregator;

/**
 * Read-only collaborators shared by all rules of a run. Holds no mutable state,
 * so one instance serves every entity task.
 */
public final class RuleEnvironment {
    public final AlignmentEngine alignment;
    public final RollingAggregator rolling;
    public final StalenessPolicy staleness;
    public final int dividendTtmDays;

    public RuleEnvironment(AlignmentEngine alignment, RollingAggregator rolling, StalenessPolicy staleness, int dividendTtmDays) {
        this.alignment = alignment;
        this.rolling = rolling;
        this.staleness = staleness;
        this.dividendTtmDays = Math.max(1, dividendTtmDays);
    }

    public static RuleEnvironment from(EngineSettings settings) {
        return new RuleEnvironment(
                new AlignmentEngine(settings.priceFallbackTradingDays, settings.fundamentalMaxLookbackDays),
                new RollingAggregator(settings.sentimentWindowDays, settings.momentumWindow, settings.volatilityWindow),
                new StalenessPolicy(settings.financialSoftDays, settings.financialHardDays, settings.priceStaleAfterTradingDays),
                settings.dividendTtmDays
        );
    }
}
