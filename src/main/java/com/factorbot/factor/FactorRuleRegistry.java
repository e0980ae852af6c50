package com.factorbot.factor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered registry of factor rules keyed by factor name. Adding a factor means
 * registering one more rule; the engine itself does not change.
 */
public final class FactorRuleRegistry {
    private final Map<String, FactorRule> rules;

    private FactorRuleRegistry(Map<String, FactorRule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static FactorRuleRegistry defaults() {
        return of(List.of(
                new DividendYieldRule(),
                new EbitdaMarginRule(),
                new DebtToEquityRule(),
                new PbRatioRule(),
                new SentimentAverageRule(),
                new ArticleCountRule(),
                new MomentumRule(),
                new VolatilityRule()
        ));
    }

    public static FactorRuleRegistry of(Collection<? extends FactorRule> rules) {
        Map<String, FactorRule> byName = new LinkedHashMap<>();
        for (FactorRule rule : rules) {
            if (rule == null) {
                continue;
            }
            FactorRule previous = byName.putIfAbsent(rule.factorName(), rule);
            if (previous != null) {
                throw new IllegalArgumentException("duplicate factor rule: " + rule.factorName());
            }
        }
        return new FactorRuleRegistry(byName);
    }

    /**
     * Registry restricted to the named factors, in registration order. Unknown names are rejected.
     */
    public FactorRuleRegistry select(Collection<String> factorNames) {
        if (factorNames == null || factorNames.isEmpty()) {
            return this;
        }
        List<FactorRule> selected = new ArrayList<>();
        for (String name : factorNames) {
            FactorRule rule = rules.get(name == null ? "" : name.trim());
            if (rule == null) {
                throw new IllegalArgumentException("unknown factor: " + name);
            }
            selected.add(rule);
        }
        return of(selected);
    }

    public FactorRule get(String factorName) {
        return rules.get(factorName);
    }

    public Collection<FactorRule> rules() {
        return rules.values();
    }

    public Set<String> factorNames() {
        return rules.keySet();
    }

    public int size() {
        return rules.size();
    }
}
