package com.factorbot.factor;

import com.factorbot.align.EntityTimeline;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityVerdict;
import com.factorbot.rolling.PriceWindow;

import java.time.LocalDate;

/**
 * Base for trading-day price statistics evaluated on each of the entity's
 * trading dates. Short history drops the row rather than reporting zero.
 */
public abstract class PriceWindowRule implements FactorRule {

    /**
     * The statistic this rule reports, null when the window is not full.
     */
    protected abstract Double statistic(PriceWindow window);

    @Override
    public MetricFrequency gridFrequency() {
        return MetricFrequency.DAILY;
    }

    @Override
    public boolean appliesTo(EntityTimeline timeline) {
        return timeline.hasMetric(Metrics.ADJUSTED_CLOSE_PRICE);
    }

    @Override
    public AlignedInputs align(RuleEnvironment env, EntityTimeline timeline, LocalDate asOf) {
        return AlignedInputs.builder(timeline.entityId(), asOf)
                .priceWindow(env.rolling.price(timeline, Metrics.ADJUSTED_CLOSE_PRICE, asOf))
                .build();
    }

    @Override
    public QualityVerdict judge(RuleEnvironment env, AlignedInputs inputs) {
        if (inputs.priceWindow == null || statistic(inputs.priceWindow) == null) {
            return QualityVerdict.drop(DropReasons.INSUFFICIENT_HISTORY);
        }
        return QualityVerdict.keep();
    }

    @Override
    public double compute(AlignedInputs inputs) {
        return statistic(inputs.priceWindow);
    }

    @Override
    public LocalDate sourceReportDate(AlignedInputs inputs) {
        if (inputs.priceWindow == null || inputs.priceWindow.anchorDate() == null) {
            return inputs.asOf;
        }
        return inputs.priceWindow.anchorDate();
    }
}
