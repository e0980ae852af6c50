package com.factorbot.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * One curated factor row. Identity is (entity, observation date, factor name).
 */
public final class FactorObservation {
    public static final String SOURCE_FACTOR_TRANSFORM = "factor_transform";

    public final String entityId;
    public final LocalDate observationDate;
    public final String factorName;
    public final Double factorValue;
    public final String source;
    public final MetricFrequency frequency;
    public final LocalDate sourceReportDate;
    public final Set<QualityFlag> qualityFlags;

    public FactorObservation(
            String entityId,
            LocalDate observationDate,
            String factorName,
            Double factorValue,
            String source,
            MetricFrequency frequency,
            LocalDate sourceReportDate,
            Set<QualityFlag> qualityFlags
    ) {
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.observationDate = Objects.requireNonNull(observationDate, "observationDate");
        this.factorName = Objects.requireNonNull(factorName, "factorName");
        this.factorValue = factorValue;
        this.source = source == null || source.isBlank() ? SOURCE_FACTOR_TRANSFORM : source;
        this.frequency = frequency == null ? MetricFrequency.UNKNOWN : frequency;
        this.sourceReportDate = sourceReportDate;
        EnumSet<QualityFlag> copy = EnumSet.noneOf(QualityFlag.class);
        if (qualityFlags != null) {
            copy.addAll(qualityFlags);
        }
        this.qualityFlags = Collections.unmodifiableSet(copy);
    }

    public FactorKey key() {
        return new FactorKey(entityId, observationDate, factorName);
    }

    public FactorObservation withValue(double newValue, QualityFlag extraFlag) {
        EnumSet<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
        flags.addAll(qualityFlags);
        if (extraFlag != null) {
            flags.add(extraFlag);
        }
        return new FactorObservation(entityId, observationDate, factorName, newValue, source, frequency, sourceReportDate, flags);
    }

    public boolean hasFlag(QualityFlag flag) {
        return qualityFlags.contains(flag);
    }

    /**
     * Comma separated flag labels, empty when the row is clean.
     */
    public String flagsText() {
        StringJoiner joiner = new StringJoiner(",");
        for (QualityFlag flag : qualityFlags) {
            joiner.add(flag.label());
        }
        return joiner.toString();
    }

    @Override
    public String toString() {
        return "FactorObservation{" + entityId + ", " + observationDate + ", " + factorName + "=" + factorValue
                + ", flags=" + flagsText() + "}";
    }

    /**
     * Business-unique key of a factor row.
     */
    public record FactorKey(String entityId, LocalDate observationDate, String factorName) {
    }
}
