package com.factorbot.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One raw metric value for one entity on one date, in canonical shape.
 * A null {@link #value} means "reported but unusable".
 */
public final class AtomicObservation {
    public final String entityId;
    public final LocalDate observationDate;
    public final String metricName;
    public final Double value;
    public final String source;
    public final MetricFrequency frequency;
    public final LocalDate reportReferenceDate;

    public AtomicObservation(
            String entityId,
            LocalDate observationDate,
            String metricName,
            Double value,
            String source,
            MetricFrequency frequency,
            LocalDate reportReferenceDate
    ) {
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.observationDate = Objects.requireNonNull(observationDate, "observationDate");
        this.metricName = Objects.requireNonNull(metricName, "metricName");
        this.value = value;
        this.source = source == null || source.isBlank() ? "unknown" : source;
        this.frequency = frequency == null ? MetricFrequency.UNKNOWN : frequency;
        this.reportReferenceDate = reportReferenceDate;
    }

    /**
     * Date the value became knowable: the report reference date when present,
     * otherwise the observation date.
     */
    public LocalDate referenceDate() {
        return reportReferenceDate == null ? observationDate : reportReferenceDate;
    }

    @Override
    public String toString() {
        return "AtomicObservation{" + entityId + ", " + observationDate + ", " + metricName + "=" + value
                + ", ref=" + referenceDate() + "}";
    }
}
