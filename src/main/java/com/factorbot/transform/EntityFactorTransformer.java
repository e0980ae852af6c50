package com.factorbot.transform;

import com.factorbot.align.CalendarGrid;
import com.factorbot.align.EntityTimeline;
import com.factorbot.factor.AlignedInputs;
import com.factorbot.factor.FactorRule;
import com.factorbot.factor.FactorRuleRegistry;
import com.factorbot.factor.Metrics;
import com.factorbot.factor.RuleEnvironment;
import com.factorbot.model.AtomicObservation;
import com.factorbot.model.FactorObservation;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityVerdict;
import com.factorbot.model.RunContext;
import com.factorbot.quality.QualityTally;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every applicable rule for one entity across its evaluation grid:
 * align, judge, and compute the kept candidates. Shares nothing mutable with
 * other entities, so instances are safe to call from any worker.
 */
public final class EntityFactorTransformer {
    static final String NON_FINITE_VALUE = "non_finite_value";

    private final FactorRuleRegistry registry;
    private final RuleEnvironment env;
    private final boolean includeRunDate;

    public EntityFactorTransformer(FactorRuleRegistry registry, RuleEnvironment env, boolean includeRunDate) {
        this.registry = registry;
        this.env = env;
        this.includeRunDate = includeRunDate;
    }

    public EntityResult transform(EntityTimeline timeline, RunContext context) {
        QualityTally tally = new QualityTally();
        List<FactorObservation> rows = new ArrayList<>();
        LocalDate start = context.windowStart();
        LocalDate end = context.runDate;
        List<LocalDate> tradingDates = null;

        for (FactorRule rule : registry.rules()) {
            if (!rule.appliesTo(timeline)) {
                continue;
            }
            List<LocalDate> grid;
            if (rule.gridFrequency() == MetricFrequency.DAILY) {
                if (tradingDates == null) {
                    tradingDates = tradingDates(timeline, start, end);
                }
                grid = tradingDates;
            } else {
                grid = CalendarGrid.periodEnds(rule.gridFrequency(), start, end, includeRunDate);
            }
            for (LocalDate asOf : grid) {
                evaluate(rule, timeline, asOf, rows, tally);
            }
        }
        return EntityResult.ok(timeline.entityId(), rows, tally);
    }

    private void evaluate(FactorRule rule, EntityTimeline timeline, LocalDate asOf, List<FactorObservation> rows, QualityTally tally) {
        AlignedInputs inputs = rule.align(env, timeline, asOf);
        QualityVerdict verdict = rule.judge(env, inputs);
        if (!verdict.keep) {
            tally.recordDropped(timeline.entityId(), asOf, rule.factorName(), verdict);
            return;
        }
        double value = rule.compute(inputs);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            tally.recordDropped(timeline.entityId(), asOf, rule.factorName(), QualityVerdict.drop(NON_FINITE_VALUE));
            return;
        }
        FactorObservation row = new FactorObservation(
                timeline.entityId(),
                asOf,
                rule.factorName(),
                value,
                FactorObservation.SOURCE_FACTOR_TRANSFORM,
                rule.gridFrequency(),
                rule.sourceReportDate(inputs),
                verdict.flags
        );
        rows.add(row);
        tally.recordKept(row);
    }

    private static List<LocalDate> tradingDates(EntityTimeline timeline, LocalDate start, LocalDate end) {
        List<LocalDate> priceDates = new ArrayList<>();
        for (AtomicObservation observation : timeline.history(Metrics.ADJUSTED_CLOSE_PRICE, end)) {
            if (observation.value != null && observation.value > 0.0) {
                priceDates.add(observation.referenceDate());
            }
        }
        return CalendarGrid.tradingDates(priceDates, start, end);
    }
}
