package com.factorbot.quality;

import com.factorbot.align.AlignedValue;

/**
 * Age tiers for carried-forward values.
 *
 * <p>Fundamentals: age in (soft, hard] is stale, age above hard is expired.
 * Prices: a fallback more than {@code priceStaleAfterTradingDays} trading days
 * behind the as-of date is stale.</p>
 */
public final class StalenessPolicy {
    public enum Tier {
        FRESH,
        STALE,
        EXPIRED
    }

    private final int softDays;
    private final int hardDays;
    private final int priceStaleAfterTradingDays;

    public StalenessPolicy(int softDays, int hardDays, int priceStaleAfterTradingDays) {
        if (hardDays < softDays) {
            throw new IllegalArgumentException("hard expiry must not be below the soft threshold: soft="
                    + softDays + ", hard=" + hardDays);
        }
        this.softDays = softDays;
        this.hardDays = hardDays;
        this.priceStaleAfterTradingDays = Math.max(0, priceStaleAfterTradingDays);
    }

    public Tier financialTier(long ageDays) {
        if (ageDays > hardDays) {
            return Tier.EXPIRED;
        }
        if (ageDays > softDays) {
            return Tier.STALE;
        }
        return Tier.FRESH;
    }

    /**
     * Tier of the oldest of the given inputs; unavailable inputs are ignored.
     */
    public Tier financialTier(AlignedValue... inputs) {
        long oldest = 0L;
        for (AlignedValue input : inputs) {
            if (input != null && input.available) {
                oldest = Math.max(oldest, input.ageDays);
            }
        }
        return financialTier(oldest);
    }

    public boolean stalePrice(AlignedValue price) {
        return price != null && price.available && price.lagTradingDays > priceStaleAfterTradingDays;
    }
}
