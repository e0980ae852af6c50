package com.factorbot.factor;

import com.factorbot.align.EntityTimeline;
import com.factorbot.model.AtomicObservation;
import com.factorbot.model.QualityFlag;
import com.factorbot.model.QualityVerdict;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.factorbot.ObservationFixtures.defaultEnv;
import static com.factorbot.ObservationFixtures.financial;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DebtToEquityRuleTest {

    private static final LocalDate REPORTED = LocalDate.of(2023, 3, 31);

    private final RuleEnvironment env = defaultEnv();
    private final DebtToEquityRule rule = new DebtToEquityRule();

    @Test
    void judge_shouldKeepStaleFundamentalsWithFlag() {
        EntityTimeline timeline = timeline(
                financial("AAA", REPORTED, Metrics.TOTAL_DEBT, 120.0),
                financial("AAA", REPORTED, Metrics.BOOK_VALUE, 100.0)
        );

        AlignedInputs inputs = rule.align(env, timeline, REPORTED.plusDays(273));
        QualityVerdict verdict = rule.judge(env, inputs);

        assertTrue(verdict.keep);
        assertTrue(verdict.flags.contains(QualityFlag.FINANCIAL_STALE));
        assertEquals(1.2, rule.compute(inputs), 1e-9);
        assertEquals(REPORTED, rule.sourceReportDate(inputs));
    }

    @Test
    void judge_shouldDropExpiredFundamentals() {
        EntityTimeline timeline = timeline(
                financial("AAA", REPORTED, Metrics.TOTAL_DEBT, 120.0),
                financial("AAA", REPORTED, Metrics.BOOK_VALUE, 100.0)
        );

        QualityVerdict verdict = rule.judge(env, rule.align(env, timeline, REPORTED.plusDays(396)));

        assertFalse(verdict.keep);
        assertEquals(DropReasons.DATA_EXPIRED, verdict.reason);
        assertTrue(verdict.flags.contains(QualityFlag.DATA_EXPIRED));
    }

    @Test
    void compute_shouldSumDebtComponentsWhenTotalIsMissing() {
        EntityTimeline timeline = timeline(
                financial("AAA", REPORTED, Metrics.SHORT_TERM_DEBT, 30.0),
                financial("AAA", REPORTED, Metrics.LONG_TERM_DEBT, 50.0),
                financial("AAA", REPORTED, Metrics.BOOK_VALUE, 100.0)
        );

        AlignedInputs inputs = rule.align(env, timeline, LocalDate.of(2023, 6, 30));

        assertTrue(rule.judge(env, inputs).keep);
        assertEquals(0.8, rule.compute(inputs), 1e-9);
    }

    @Test
    void compute_shouldUseSingleAvailableComponent() {
        EntityTimeline timeline = timeline(
                financial("AAA", REPORTED, Metrics.LONG_TERM_DEBT, 50.0),
                financial("AAA", REPORTED, Metrics.BOOK_VALUE, 100.0)
        );

        AlignedInputs inputs = rule.align(env, timeline, LocalDate.of(2023, 6, 30));

        assertEquals(0.5, rule.compute(inputs), 1e-9);
    }

    @Test
    void judge_shouldDropWhenNoDebtIsReported() {
        EntityTimeline timeline = timeline(financial("AAA", REPORTED, Metrics.BOOK_VALUE, 100.0));

        QualityVerdict verdict = rule.judge(env, rule.align(env, timeline, LocalDate.of(2023, 6, 30)));

        assertEquals(DropReasons.DEBT_MISSING, verdict.reason);
    }

    @Test
    void judge_shouldDropNonPositiveEquity() {
        EntityTimeline timeline = timeline(
                financial("AAA", REPORTED, Metrics.TOTAL_DEBT, 120.0),
                financial("AAA", REPORTED, Metrics.BOOK_VALUE, -5.0)
        );

        QualityVerdict verdict = rule.judge(env, rule.align(env, timeline, LocalDate.of(2023, 6, 30)));

        assertFalse(verdict.keep);
        assertEquals(DropReasons.EQUITY_NON_POSITIVE, verdict.reason);
    }

    private static EntityTimeline timeline(AtomicObservation... observations) {
        return EntityTimeline.of("AAA", List.of(observations));
    }
}
