package com.factorbot.rolling;

import com.factorbot.align.CloseSeries;
import com.factorbot.align.EntityTimeline;
import com.factorbot.model.AtomicObservation;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

/**
 * Calendar-time sentiment windows and trading-day price windows.
 */
public final class RollingAggregator {
    private final int sentimentWindowDays;
    private final int momentumWindow;
    private final int volatilityWindow;

    public RollingAggregator(int sentimentWindowDays, int momentumWindow, int volatilityWindow) {
        this.sentimentWindowDays = Math.max(1, sentimentWindowDays);
        this.momentumWindow = Math.max(1, momentumWindow);
        this.volatilityWindow = Math.max(2, volatilityWindow);
    }

    /**
     * Trailing sentiment window ending on {@code asOf}. Same-day scores are
     * averaged; days without articles are filled with 0.0 before the mean is
     * taken, so the denominator is always the window length in calendar days.
     */
    public SentimentWindow sentiment(EntityTimeline timeline, String scoreMetric, String countMetric, LocalDate asOf) {
        LocalDate start = asOf.minusDays(sentimentWindowDays - 1L);
        TreeMap<LocalDate, double[]> scoreByDay = new TreeMap<>();
        for (AtomicObservation observation : timeline.history(scoreMetric, asOf)) {
            LocalDate day = observation.referenceDate();
            if (day.isBefore(start) || observation.value == null) {
                continue;
            }
            double[] acc = scoreByDay.computeIfAbsent(day, ignored -> new double[2]);
            acc[0] += observation.value;
            acc[1] += 1.0;
        }
        Map<LocalDate, Double> reportedCounts = new TreeMap<>();
        if (countMetric != null) {
            for (AtomicObservation observation : timeline.history(countMetric, asOf)) {
                LocalDate day = observation.referenceDate();
                if (day.isBefore(start) || observation.value == null) {
                    continue;
                }
                reportedCounts.merge(day, observation.value, Double::sum);
            }
        }

        TreeMap<LocalDate, Double> dailyScore = new TreeMap<>();
        TreeMap<LocalDate, Double> dailyCount = new TreeMap<>();
        for (LocalDate day = start; !day.isAfter(asOf); day = day.plusDays(1)) {
            double[] acc = scoreByDay.get(day);
            dailyScore.put(day, acc == null ? 0.0 : acc[0] / acc[1]);
            Double reported = reportedCounts.get(day);
            if (reported != null) {
                dailyCount.put(day, reported);
            } else {
                dailyCount.put(day, acc == null ? 0.0 : acc[1]);
            }
        }

        double scoreSum = 0.0;
        double countSum = 0.0;
        LocalDate lastArticleDay = null;
        for (Map.Entry<LocalDate, Double> entry : dailyScore.entrySet()) {
            scoreSum += entry.getValue();
            double count = dailyCount.get(entry.getKey());
            countSum += count;
            if (count > 0.0 || scoreByDay.containsKey(entry.getKey())) {
                lastArticleDay = entry.getKey();
            }
        }
        double mean = clamp(scoreSum / sentimentWindowDays, -1.0, 1.0);
        return new SentimentWindow(mean, countSum, lastArticleDay);
    }

    /**
     * Momentum and volatility anchored on the last usable price at or before
     * {@code asOf}. Either statistic is null when fewer returns than its window exist.
     */
    public PriceWindow price(EntityTimeline timeline, String priceMetric, LocalDate asOf) {
        CloseSeries series = timeline.closeSeries(priceMetric);
        int size = series.countUpTo(asOf);
        if (size == 0) {
            return PriceWindow.empty();
        }
        int anchor = size - 1;
        int returnCount = anchor;
        Double momentum = null;
        if (returnCount >= momentumWindow) {
            momentum = series.close(anchor) / series.close(anchor - momentumWindow) - 1.0;
        }
        Double volatility = null;
        if (returnCount >= volatilityWindow) {
            double[] returns = new double[volatilityWindow];
            for (int i = 0; i < volatilityWindow; i++) {
                int idx = size - volatilityWindow + i;
                returns[i] = series.close(idx) / series.close(idx - 1) - 1.0;
            }
            volatility = sampleStd(returns);
        }
        return new PriceWindow(series.date(anchor), returnCount, momentum, volatility);
    }

    private static double sampleStd(double[] values) {
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double sq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / (values.length - 1));
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        return Math.min(value, max);
    }
}
