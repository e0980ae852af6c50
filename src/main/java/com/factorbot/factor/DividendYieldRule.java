package com.factorbot.factor;

import com.factorbot.align.AlignedValue;
import com.factorbot.align.EntityTimeline;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityFlag;
import com.factorbot.model.QualityVerdict;

import java.time.LocalDate;
import java.util.EnumSet;

/**
 * Trailing twelve month dividends over the aligned price. No dividends in the
 * window is a genuine zero yield.
 */
public final class DividendYieldRule implements FactorRule {
    public static final String NAME = "dividend_yield";
    static final String TTM_DIVIDEND = "ttm_dividend";

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
        return timeline.hasMetric(Metrics.ADJUSTED_CLOSE_PRICE);
    }

    @Override
    public AlignedInputs align(RuleEnvironment env, EntityTimeline timeline, LocalDate asOf) {
        AlignedValue price = env.alignment.priceAsOf(timeline, Metrics.ADJUSTED_CLOSE_PRICE, asOf);
        AlignedInputs.Builder builder = AlignedInputs.builder(timeline.entityId(), asOf)
                .value(Metrics.ADJUSTED_CLOSE_PRICE, price);
        if (price.available) {
            LocalDate priceDate = price.referenceDate;
            double ttm = env.alignment.sumWindow(
                    timeline,
                    Metrics.DIVIDEND_PER_SHARE,
                    priceDate.minusDays(env.dividendTtmDays),
                    priceDate
            );
            builder.derived(TTM_DIVIDEND, ttm);
        }
        return builder.build();
    }

    @Override
    public QualityVerdict judge(RuleEnvironment env, AlignedInputs inputs) {
        AlignedValue price = inputs.get(Metrics.ADJUSTED_CLOSE_PRICE);
        if (!price.positive()) {
            return QualityVerdict.drop(DropReasons.PRICE_UNUSABLE);
        }
        EnumSet<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
        if (env.staleness.stalePrice(price)) {
            flags.add(QualityFlag.STALE_PRICE);
        }
        return QualityVerdict.keep(flags);
    }

    @Override
    public double compute(AlignedInputs inputs) {
        return inputs.derived(TTM_DIVIDEND, 0.0) / inputs.get(Metrics.ADJUSTED_CLOSE_PRICE).value;
    }

    @Override
    public LocalDate sourceReportDate(AlignedInputs inputs) {
        AlignedValue price = inputs.get(Metrics.ADJUSTED_CLOSE_PRICE);
        return price.available ? price.referenceDate : inputs.asOf;
    }
}
