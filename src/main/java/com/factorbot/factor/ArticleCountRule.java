package com.factorbot.factor;

/**
 * Article count over the same trailing window as {@link SentimentAverageRule}.
 */
public final class ArticleCountRule extends SentimentAverageRule {
    public static final String NAME = "article_count_30d";

    @Override
    public String factorName() {
        return NAME;
    }

    @Override
    public double compute(AlignedInputs inputs) {
        return window(inputs).articleCount();
    }
}
