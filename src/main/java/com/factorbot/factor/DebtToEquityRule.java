package com.factorbot.factor;

import com.factorbot.align.AlignedValue;
import com.factorbot.align.EntityTimeline;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityVerdict;
import com.factorbot.quality.StalenessPolicy;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Total debt over book equity on the quarterly grid. When total debt is not
 * reported, the sum of the available short and long term components stands in.
 */
public final class DebtToEquityRule implements FactorRule {
    public static final String NAME = "debt_to_equity";

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
        return timeline.hasMetric(Metrics.BOOK_VALUE)
                || timeline.hasMetric(Metrics.TOTAL_DEBT)
                || timeline.hasMetric(Metrics.SHORT_TERM_DEBT)
                || timeline.hasMetric(Metrics.LONG_TERM_DEBT);
    }

    @Override
    public AlignedInputs align(RuleEnvironment env, EntityTimeline timeline, LocalDate asOf) {
        return AlignedInputs.builder(timeline.entityId(), asOf)
                .value(Metrics.TOTAL_DEBT, env.alignment.asOf(timeline, Metrics.TOTAL_DEBT, asOf))
                .value(Metrics.SHORT_TERM_DEBT, env.alignment.asOf(timeline, Metrics.SHORT_TERM_DEBT, asOf))
                .value(Metrics.LONG_TERM_DEBT, env.alignment.asOf(timeline, Metrics.LONG_TERM_DEBT, asOf))
                .value(Metrics.BOOK_VALUE, env.alignment.asOf(timeline, Metrics.BOOK_VALUE, asOf))
                .build();
    }

    @Override
    public QualityVerdict judge(RuleEnvironment env, AlignedInputs inputs) {
        List<AlignedValue> debt = debtInputs(inputs);
        if (debt.isEmpty()) {
            return QualityVerdict.drop(DropReasons.DEBT_MISSING);
        }
        AlignedValue equity = inputs.get(Metrics.BOOK_VALUE);
        if (!equity.usable()) {
            return QualityVerdict.drop(DropReasons.INPUT_MISSING);
        }
        List<AlignedValue> used = new ArrayList<>(debt);
        used.add(equity);
        StalenessPolicy.Tier tier = FinancialRules.tier(env.staleness, used.toArray(new AlignedValue[0]));
        QualityVerdict expired = FinancialRules.expiryVerdict(tier);
        if (expired != null) {
            return expired;
        }
        if (equity.value <= 0.0) {
            return QualityVerdict.drop(DropReasons.EQUITY_NON_POSITIVE);
        }
        return QualityVerdict.keep(FinancialRules.staleFlags(tier));
    }

    @Override
    public double compute(AlignedInputs inputs) {
        double debt = 0.0;
        for (AlignedValue component : debtInputs(inputs)) {
            debt += component.value;
        }
        return debt / inputs.get(Metrics.BOOK_VALUE).value;
    }

    // total debt when reported, otherwise whichever components are present
    static List<AlignedValue> debtInputs(AlignedInputs inputs) {
        AlignedValue total = inputs.get(Metrics.TOTAL_DEBT);
        if (total.usable()) {
            return List.of(total);
        }
        List<AlignedValue> components = new ArrayList<>(2);
        AlignedValue shortTerm = inputs.get(Metrics.SHORT_TERM_DEBT);
        AlignedValue longTerm = inputs.get(Metrics.LONG_TERM_DEBT);
        if (shortTerm.usable()) {
            components.add(shortTerm);
        }
        if (longTerm.usable()) {
            components.add(longTerm);
        }
        return components;
    }
}
