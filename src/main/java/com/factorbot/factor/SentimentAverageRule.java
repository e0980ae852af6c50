package com.factorbot.factor;

import com.factorbot.align.EntityTimeline;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityVerdict;
import com.factorbot.rolling.SentimentWindow;

import java.time.LocalDate;

/**
 * Trailing calendar-window mean of daily news sentiment. Never dropped: a
 * window without articles is a neutral 0.0.
 */
public class SentimentAverageRule implements FactorRule {
    public static final String NAME = "sentiment_30d_avg";

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
        return timeline.hasMetric(Metrics.NEWS_SENTIMENT_DAILY) || timeline.hasMetric(Metrics.NEWS_ARTICLE_COUNT_DAILY);
    }

    @Override
    public AlignedInputs align(RuleEnvironment env, EntityTimeline timeline, LocalDate asOf) {
        SentimentWindow window = env.rolling.sentiment(
                timeline,
                Metrics.NEWS_SENTIMENT_DAILY,
                Metrics.NEWS_ARTICLE_COUNT_DAILY,
                asOf
        );
        return AlignedInputs.builder(timeline.entityId(), asOf)
                .sentiment(window)
                .build();
    }

    @Override
    public QualityVerdict judge(RuleEnvironment env, AlignedInputs inputs) {
        return QualityVerdict.keep();
    }

    @Override
    public double compute(AlignedInputs inputs) {
        return window(inputs).mean();
    }

    @Override
    public LocalDate sourceReportDate(AlignedInputs inputs) {
        LocalDate last = window(inputs).lastArticleDate();
        return last == null ? inputs.asOf : last;
    }

    static SentimentWindow window(AlignedInputs inputs) {
        return inputs.sentiment == null ? new SentimentWindow(0.0, 0.0, null) : inputs.sentiment;
    }
}
