package com.factorbot.factor;

import com.factorbot.align.EntityTimeline;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.factorbot.ObservationFixtures.daily;
import static com.factorbot.ObservationFixtures.defaultEnv;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SentimentRulesTest {

    private static final LocalDate MONTH_END = LocalDate.of(2024, 4, 30);

    private final RuleEnvironment env = defaultEnv();

    @Test
    void sentimentAverage_shouldKeepQuietWindowAsZero() {
        SentimentAverageRule rule = new SentimentAverageRule();
        EntityTimeline timeline = EntityTimeline.of("AAA", List.of(
                daily("AAA", LocalDate.of(2024, 1, 10), Metrics.NEWS_SENTIMENT_DAILY, 0.7)
        ));

        AlignedInputs inputs = rule.align(env, timeline, MONTH_END);

        assertTrue(rule.appliesTo(timeline));
        assertTrue(rule.judge(env, inputs).keep);
        assertEquals(0.0, rule.compute(inputs), 1e-12);
        assertEquals(MONTH_END, rule.sourceReportDate(inputs));
    }

    @Test
    void articleCount_shouldSumDailyCountsInWindow() {
        ArticleCountRule rule = new ArticleCountRule();
        EntityTimeline timeline = EntityTimeline.of("AAA", List.of(
                daily("AAA", LocalDate.of(2024, 4, 2), Metrics.NEWS_SENTIMENT_DAILY, 0.3),
                daily("AAA", LocalDate.of(2024, 4, 2), Metrics.NEWS_ARTICLE_COUNT_DAILY, 3.0),
                daily("AAA", LocalDate.of(2024, 4, 20), Metrics.NEWS_ARTICLE_COUNT_DAILY, 4.0)
        ));

        AlignedInputs inputs = rule.align(env, timeline, MONTH_END);

        assertEquals("article_count_30d", rule.factorName());
        assertEquals(7.0, rule.compute(inputs), 1e-12);
        assertEquals(LocalDate.of(2024, 4, 20), rule.sourceReportDate(inputs));
    }
}
