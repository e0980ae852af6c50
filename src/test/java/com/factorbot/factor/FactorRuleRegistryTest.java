package com.factorbot.factor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactorRuleRegistryTest {

    @Test
    void defaults_shouldRegisterEveryCuratedFactorInOrder() {
        FactorRuleRegistry registry = FactorRuleRegistry.defaults();

        assertEquals(List.of(
                "dividend_yield",
                "ebitda_margin",
                "debt_to_equity",
                "pb_ratio",
                "sentiment_30d_avg",
                "article_count_30d",
                "momentum_1m",
                "volatility_20d"
        ), List.copyOf(registry.factorNames()));
    }

    @Test
    void select_shouldRestrictToNamedFactors() {
        FactorRuleRegistry registry = FactorRuleRegistry.defaults();

        FactorRuleRegistry selected = registry.select(List.of(" pb_ratio", "momentum_1m"));

        assertEquals(2, selected.size());
        assertTrue(selected.get("pb_ratio") instanceof PbRatioRule);
        assertSame(registry, registry.select(List.of()));
    }

    @Test
    void select_shouldRejectUnknownFactor() {
        assertThrows(IllegalArgumentException.class, () -> FactorRuleRegistry.defaults().select(List.of("alpha_42")));
    }

    @Test
    void of_shouldRejectDuplicateNames() {
        assertThrows(IllegalArgumentException.class,
                () -> FactorRuleRegistry.of(List.of(new MomentumRule(), new MomentumRule())));
    }
}
