package com.factorbot.quality;

import com.factorbot.align.AlignedValue;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StalenessPolicyTest {

    private final StalenessPolicy policy = new StalenessPolicy(270, 365, 1);

    @Test
    void financialTier_shouldSwitchAtSoftAndHardThresholds() {
        assertEquals(StalenessPolicy.Tier.FRESH, policy.financialTier(270));
        assertEquals(StalenessPolicy.Tier.STALE, policy.financialTier(271));
        assertEquals(StalenessPolicy.Tier.STALE, policy.financialTier(365));
        assertEquals(StalenessPolicy.Tier.EXPIRED, policy.financialTier(366));
    }

    @Test
    void financialTier_shouldNeverImproveAsAgeGrows() {
        StalenessPolicy.Tier previous = StalenessPolicy.Tier.FRESH;
        for (long age = 0; age <= 800; age++) {
            StalenessPolicy.Tier tier = policy.financialTier(age);
            assertTrue(tier.ordinal() >= previous.ordinal(), "tier regressed at age " + age);
            previous = tier;
        }
    }

    @Test
    void financialTier_shouldFollowTheOldestAvailableInput() {
        LocalDate ref = LocalDate.of(2023, 1, 1);
        AlignedValue fresh = AlignedValue.of(1.0, ref, ref, 10, 0);
        AlignedValue old = AlignedValue.of(1.0, ref, ref, 300, 0);

        assertEquals(StalenessPolicy.Tier.STALE, policy.financialTier(fresh, old, AlignedValue.unavailable()));
        assertEquals(StalenessPolicy.Tier.FRESH, policy.financialTier(fresh));
    }

    @Test
    void stalePrice_shouldFlagFallbackOfMoreThanOneTradingDay() {
        LocalDate ref = LocalDate.of(2024, 2, 29);
        assertFalse(policy.stalePrice(AlignedValue.of(10.0, ref, ref, 1, 1)));
        assertTrue(policy.stalePrice(AlignedValue.of(10.0, ref, ref, 4, 2)));
        assertFalse(policy.stalePrice(AlignedValue.unavailable()));
    }

    @Test
    void constructor_shouldRejectHardExpiryBelowSoftThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new StalenessPolicy(300, 200, 1));
    }
}
