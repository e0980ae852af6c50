package com.factorbot.factor;

import com.factorbot.align.AlignedValue;
import com.factorbot.align.EntityTimeline;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityVerdict;
import com.factorbot.quality.StalenessPolicy;

import java.time.LocalDate;

/**
 * EBITDA over revenue on the quarterly grid.
 */
public final class EbitdaMarginRule implements FactorRule {
    public static final String NAME = "ebitda_margin";

    @Override
    public String factorName() {
        return NAME;
    }

    @Override
    public MetricFrequency gridFrequency() {
        return MetricFrequency.QUARTERLY;
    }

    @Override
    public boolean appliesTo(EntityTimeline timeline) {
        return timeline.hasMetric(Metrics.ENTERPRISE_EBITDA) || timeline.hasMetric(Metrics.ENTERPRISE_REVENUE);
    }

    @Override
    public AlignedInputs align(RuleEnvironment env, EntityTimeline timeline, LocalDate asOf) {
        return AlignedInputs.builder(timeline.entityId(), asOf)
                .value(Metrics.ENTERPRISE_EBITDA, env.alignment.asOf(timeline, Metrics.ENTERPRISE_EBITDA, asOf))
                .value(Metrics.ENTERPRISE_REVENUE, env.alignment.asOf(timeline, Metrics.ENTERPRISE_REVENUE, asOf))
                .build();
    }

    @Override
    public QualityVerdict judge(RuleEnvironment env, AlignedInputs inputs) {
        AlignedValue ebitda = inputs.get(Metrics.ENTERPRISE_EBITDA);
        AlignedValue revenue = inputs.get(Metrics.ENTERPRISE_REVENUE);
        if (!ebitda.usable() || !revenue.usable()) {
            return QualityVerdict.drop(DropReasons.INPUT_MISSING);
        }
        StalenessPolicy.Tier tier = FinancialRules.tier(env.staleness, ebitda, revenue);
        QualityVerdict expired = FinancialRules.expiryVerdict(tier);
        if (expired != null) {
            return expired;
        }
        if (revenue.value <= 0.0) {
            return QualityVerdict.drop(DropReasons.REVENUE_NON_POSITIVE);
        }
        return QualityVerdict.keep(FinancialRules.staleFlags(tier));
    }

    @Override
    public double compute(AlignedInputs inputs) {
        return inputs.get(Metrics.ENTERPRISE_EBITDA).value / inputs.get(Metrics.ENTERPRISE_REVENUE).value;
    }
}
