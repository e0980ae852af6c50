package com.factorbot.factor;

import com.factorbot.align.EntityTimeline;
import com.factorbot.model.QualityFlag;
import com.factorbot.model.QualityVerdict;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.factorbot.ObservationFixtures.defaultEnv;
import static com.factorbot.ObservationFixtures.financial;
import static com.factorbot.ObservationFixtures.price;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PbRatioRuleTest {

    private static final LocalDate MONTH_END = LocalDate.of(2024, 3, 31);

    private final RuleEnvironment env = defaultEnv();
    private final PbRatioRule rule = new PbRatioRule();

    @Test
    void compute_shouldDivideMarketCapByBookEquity() {
        AlignedInputs inputs = rule.align(env,
                timeline(LocalDate.of(2024, 3, 28), 1000.0, 10000.0, LocalDate.of(2023, 12, 31)), MONTH_END);

        QualityVerdict verdict = rule.judge(env, inputs);

        assertTrue(verdict.keep);
        assertTrue(verdict.flags.isEmpty());
        assertEquals(2.0, rule.compute(inputs), 1e-12);
        assertTrue(rule.crossSectionalCap());
    }

    @Test
    void judge_shouldFlagPriceAndFundamentalStalenessIndependently() {
        QualityVerdict verdict = rule.judge(env, rule.align(env,
                timeline(LocalDate.of(2024, 3, 27), 1000.0, 10000.0, LocalDate.of(2023, 6, 30)), MONTH_END));

        assertTrue(verdict.keep);
        assertTrue(verdict.flags.contains(QualityFlag.STALE_PRICE));
        assertTrue(verdict.flags.contains(QualityFlag.FINANCIAL_STALE));
    }

    @Test
    void judge_shouldDropUnusableSharesAndNonPositiveEquity() {
        QualityVerdict noShares = rule.judge(env, rule.align(env,
                timeline(LocalDate.of(2024, 3, 28), 0.0, 10000.0, LocalDate.of(2023, 12, 31)), MONTH_END));
        QualityVerdict negativeBook = rule.judge(env, rule.align(env,
                timeline(LocalDate.of(2024, 3, 28), 1000.0, 0.0, LocalDate.of(2023, 12, 31)), MONTH_END));

        assertFalse(noShares.keep);
        assertEquals(DropReasons.SHARES_UNUSABLE, noShares.reason);
        assertEquals(DropReasons.EQUITY_NON_POSITIVE, negativeBook.reason);
    }

    private static EntityTimeline timeline(LocalDate priceDate, Double shares, Double book, LocalDate reported) {
        return EntityTimeline.of("AAA", List.of(
                price("AAA", priceDate, 20.0),
                financial("AAA", reported, Metrics.SHARES_OUTSTANDING, shares),
                financial("AAA", reported, Metrics.BOOK_VALUE, book)
        ));
    }
}
