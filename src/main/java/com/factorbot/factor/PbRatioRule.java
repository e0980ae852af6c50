package com.factorbot.factor;

import com.factorbot.align.AlignedValue;
import com.factorbot.align.EntityTimeline;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityFlag;
import com.factorbot.model.QualityVerdict;
import com.factorbot.quality.StalenessPolicy;

import java.time.LocalDate;
import java.util.EnumSet;

/**
 * Market capitalisation over book equity. Price staleness and fundamental
 * staleness are flagged independently. Values are capped cross-sectionally
 * once every entity has been evaluated.
 */
public final class PbRatioRule implements FactorRule {
    public static final String NAME = "pb_ratio";

    @Override
    public String factorName() {
        return NAME;
    }

    @Override
    public MetricFrequency gridFrequency() {
        return MetricFrequency.MONTHLY;
    }

    @Override
    public boolean appliesTo(EntityTimeline timeline) {
        return timeline.hasMetric(Metrics.ADJUSTED_CLOSE_PRICE) && timeline.hasMetric(Metrics.BOOK_VALUE);
    }

    @Override
    public AlignedInputs align(RuleEnvironment env, EntityTimeline timeline, LocalDate asOf) {
        return AlignedInputs.builder(timeline.entityId(), asOf)
                .value(Metrics.ADJUSTED_CLOSE_PRICE, env.alignment.priceAsOf(timeline, Metrics.ADJUSTED_CLOSE_PRICE, asOf))
                .value(Metrics.SHARES_OUTSTANDING, env.alignment.asOf(timeline, Metrics.SHARES_OUTSTANDING, asOf))
                .value(Metrics.BOOK_VALUE, env.alignment.asOf(timeline, Metrics.BOOK_VALUE, asOf))
                .build();
    }

    @Override
    public QualityVerdict judge(RuleEnvironment env, AlignedInputs inputs) {
        AlignedValue price = inputs.get(Metrics.ADJUSTED_CLOSE_PRICE);
        AlignedValue shares = inputs.get(Metrics.SHARES_OUTSTANDING);
        AlignedValue equity = inputs.get(Metrics.BOOK_VALUE);
        if (!price.positive()) {
            return QualityVerdict.drop(DropReasons.PRICE_UNUSABLE);
        }
        if (!shares.positive()) {
            return QualityVerdict.drop(DropReasons.SHARES_UNUSABLE);
        }
        if (!equity.usable()) {
            return QualityVerdict.drop(DropReasons.INPUT_MISSING);
        }
        StalenessPolicy.Tier tier = FinancialRules.tier(env.staleness, shares, equity);
        QualityVerdict expired = FinancialRules.expiryVerdict(tier);
        if (expired != null) {
            return expired;
        }
        if (equity.value <= 0.0) {
            return QualityVerdict.drop(DropReasons.EQUITY_NON_POSITIVE);
        }
        EnumSet<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
        flags.addAll(FinancialRules.staleFlags(tier));
        if (env.staleness.stalePrice(price)) {
            flags.add(QualityFlag.STALE_PRICE);
        }
        return QualityVerdict.keep(flags);
    }

    @Override
    public double compute(AlignedInputs inputs) {
        double price = inputs.get(Metrics.ADJUSTED_CLOSE_PRICE).value;
        double shares = inputs.get(Metrics.SHARES_OUTSTANDING).value;
        return price * shares / inputs.get(Metrics.BOOK_VALUE).value;
    }

    @Override
    public boolean crossSectionalCap() {
        return true;
    }
}
