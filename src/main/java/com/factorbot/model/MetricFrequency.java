package com.factorbot.model;

import java.util.Locale;

/**
 * Frequency tag carried by atomic and factor rows.
 */
public enum MetricFrequency {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    QUARTERLY("quarterly"),
    ANNUAL("annual"),
    TTM("ttm"),
    SNAPSHOT("snapshot"),
    UNKNOWN("unknown");

    private final String label;

    MetricFrequency(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MetricFrequency fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return UNKNOWN;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (MetricFrequency frequency : values()) {
            if (frequency.label.equals(target)) {
                return frequency;
            }
        }
        return UNKNOWN;
    }
}
