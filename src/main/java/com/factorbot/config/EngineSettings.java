package com.factorbot.config;

/**
 * Typed thresholds of the transform engine, read once per run from {@link Config}.
 */
public final class EngineSettings {
    public final int threads;
    public final boolean includeRunDate;
    public final int priceFallbackTradingDays;
    public final int priceStaleAfterTradingDays;
    public final int fundamentalMaxLookbackDays;
    public final int dataPaddingDays;
    public final int financialSoftDays;
    public final int financialHardDays;
    public final double capPercentile;
    public final int capMinSample;
    public final double capFixed;
    public final int sentimentWindowDays;
    public final int momentumWindow;
    public final int volatilityWindow;
    public final int dividendTtmDays;
    public final int writerBatchSize;

    private EngineSettings(Config config) {
        this.threads = Math.max(1, config.getInt("run.threads"));
        this.includeRunDate = config.getBoolean("run.include_run_date", true);
        this.priceFallbackTradingDays = Math.max(0, config.getInt("align.price.fallback_trading_days"));
        this.priceStaleAfterTradingDays = Math.max(0, config.getInt("align.price.stale_after_trading_days"));
        this.fundamentalMaxLookbackDays = Math.max(1, config.getInt("align.fundamental.max_lookback_days"));
        this.dataPaddingDays = Math.max(0, config.getInt("align.data_padding_days"));
        this.financialSoftDays = Math.max(0, config.getInt("quality.financial.soft_days"));
        this.financialHardDays = Math.max(this.financialSoftDays, config.getInt("quality.financial.hard_days"));
        this.capPercentile = clamp01(config.getDouble("quality.pb.cap_percentile"));
        this.capMinSample = Math.max(1, config.getInt("quality.pb.min_sample"));
        this.capFixed = config.getDouble("quality.pb.fixed_cap");
        this.sentimentWindowDays = Math.max(1, config.getInt("rolling.sentiment.window_days"));
        this.momentumWindow = Math.max(1, config.getInt("rolling.momentum.window"));
        this.volatilityWindow = Math.max(2, config.getInt("rolling.volatility.window"));
        this.dividendTtmDays = Math.max(1, config.getInt("dividend.ttm_days"));
        this.writerBatchSize = Math.max(1, config.getInt("writer.batch_size"));
    }

    public static EngineSettings from(Config config) {
        return new EngineSettings(config);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(Config.of(null));
    }

    private static double clamp01(double value) {
        if (value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
