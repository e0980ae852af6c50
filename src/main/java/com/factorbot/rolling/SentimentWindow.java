package com.factorbot.rolling;

import java.time.LocalDate;

/**
 * Trailing calendar-window sentiment statistics for one as-of date.
 *
 * @param mean            window mean over calendar days, clamped to [-1, 1]
 * @param articleCount    articles in the window
 * @param lastArticleDate latest day with at least one article, null when the window is empty
 */
public record SentimentWindow(double mean, double articleCount, LocalDate lastArticleDate) {

    public boolean empty() {
        return lastArticleDate == null;
    }
}
