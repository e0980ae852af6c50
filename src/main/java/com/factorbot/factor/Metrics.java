package com.factorbot.factor;

import java.util.Set;

/**
 * Atomic metric names consumed by the factor rules.
 */
public final class Metrics {
    public static final String ADJUSTED_CLOSE_PRICE = "adjusted_close_price";
    public static final String DIVIDEND_PER_SHARE = "dividend_per_share";
    public static final String NEWS_SENTIMENT_DAILY = "news_sentiment_daily";
    public static final String NEWS_ARTICLE_COUNT_DAILY = "news_article_count_daily";

    public static final String TOTAL_DEBT = "total_debt";
    public static final String SHORT_TERM_DEBT = "short_term_debt";
    public static final String LONG_TERM_DEBT = "long_term_debt";
    public static final String BOOK_VALUE = "book_value";
    public static final String SHARES_OUTSTANDING = "shares_outstanding";
    public static final String ENTERPRISE_EBITDA = "enterprise_ebitda";
    public static final String ENTERPRISE_REVENUE = "enterprise_revenue";

    public static final Set<String> MARKET = Set.of(ADJUSTED_CLOSE_PRICE, DIVIDEND_PER_SHARE);

    public static final Set<String> ALTERNATIVE = Set.of(NEWS_SENTIMENT_DAILY, NEWS_ARTICLE_COUNT_DAILY);

    public static final Set<String> FINANCIAL = Set.of(
            TOTAL_DEBT,
            SHORT_TERM_DEBT,
            LONG_TERM_DEBT,
            BOOK_VALUE,
            SHARES_OUTSTANDING,
            ENTERPRISE_EBITDA,
            ENTERPRISE_REVENUE
    );

    private Metrics() {
    }

    public static boolean isFinancial(String metricName) {
        return metricName != null && FINANCIAL.contains(metricName);
    }
}
