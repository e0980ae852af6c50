package com.factorbot.transform;

import com.factorbot.align.EntityTimeline;
import com.factorbot.align.TradingCalendar;
import com.factorbot.factor.DividendYieldRule;
import com.factorbot.factor.FactorRuleRegistry;
import com.factorbot.factor.MomentumRule;
import com.factorbot.model.FactorObservation;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.RunContext;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static com.factorbot.ObservationFixtures.daily;
import static com.factorbot.ObservationFixtures.defaultEnv;
import static com.factorbot.ObservationFixtures.weekdayPrices;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityFactorTransformerTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2024, 6, 28);

    @Test
    void transform_shouldEvaluateDailyRulesOnEntityTradingDates() {
        EntityFactorTransformer transformer = new EntityFactorTransformer(
                FactorRuleRegistry.of(List.of(new MomentumRule())), defaultEnv(), true);
        EntityTimeline timeline = EntityTimeline.of("AAA",
                weekdayPrices("AAA", LocalDate.of(2023, 1, 2), RUN_DATE, 100.0, 0.001));
        RunContext context = new RunContext("run_test", RUN_DATE, MetricFrequency.MONTHLY, 1, List.of());

        EntityResult result = transformer.transform(timeline, context);

        int expected = 0;
        for (LocalDate day = context.windowStart(); !day.isAfter(RUN_DATE); day = day.plusDays(1)) {
            if (TradingCalendar.isTradingDay(day)) {
                expected++;
            }
        }
        assertEquals(LocalDate.of(2023, 6, 29), context.windowStart());
        assertEquals(expected, result.rows.size());
        assertEquals(expected, result.tally.kept());
        assertTrue(result.rows.stream().allMatch(row -> row.frequency == MetricFrequency.DAILY));
    }

    @Test
    void transform_shouldAppendRunDateToMonthlyGrid() {
        EntityFactorTransformer transformer = new EntityFactorTransformer(
                FactorRuleRegistry.of(List.of(new DividendYieldRule())), defaultEnv(), true);
        EntityTimeline timeline = EntityTimeline.of("AAA",
                weekdayPrices("AAA", LocalDate.of(2023, 1, 2), RUN_DATE, 100.0, 0.0));

        EntityResult result = transformer.transform(timeline,
                new RunContext("run_test", RUN_DATE, MetricFrequency.MONTHLY, 1, List.of()));

        List<LocalDate> dates = result.rows.stream().map(row -> row.observationDate).collect(Collectors.toList());
        assertEquals(13, dates.size());
        assertEquals(LocalDate.of(2023, 6, 30), dates.get(0));
        assertEquals(RUN_DATE, dates.get(dates.size() - 1));
        FactorObservation last = result.rows.get(result.rows.size() - 1);
        assertEquals(FactorObservation.SOURCE_FACTOR_TRANSFORM, last.source);
        assertEquals(RUN_DATE, last.sourceReportDate);
    }

    @Test
    void transform_shouldDropNonFiniteValues() {
        SignalRule divideByZero = new SignalRule("ratio", false, (entity, value) -> value / 0.0);
        EntityFactorTransformer transformer = new EntityFactorTransformer(
                FactorRuleRegistry.of(List.of(divideByZero)), defaultEnv(), false);
        EntityTimeline timeline = EntityTimeline.of("AAA", List.of(
                daily("AAA", LocalDate.of(2024, 1, 15), SignalRule.SIGNAL, 3.0)
        ));

        EntityResult result = transformer.transform(timeline,
                new RunContext("run_test", LocalDate.of(2024, 3, 31), MetricFrequency.MONTHLY, 1, List.of()));

        assertTrue(result.rows.isEmpty());
        assertEquals(3, result.tally.dropReasons().get(EntityFactorTransformer.NON_FINITE_VALUE));
    }
}
