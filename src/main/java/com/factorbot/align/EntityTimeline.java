package com.factorbot.align;

import com.factorbot.model.AtomicObservation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Atomic history of one entity, grouped by metric and ordered by reference date.
 *
 * <p>Reads go through {@link #history(String, LocalDate)}, which only ever
 * returns observations whose reference date is on or before the requested
 * as-of date, or through a {@link CloseSeries} bounded the same way. Equal reference dates keep input order, so the later record wins
 * a point lookup.</p>
 */
public final class EntityTimeline {
    private static final Comparator<AtomicObservation> BY_REFERENCE =
            Comparator.comparing(AtomicObservation::referenceDate);

    private final String entityId;
    private final Map<String, List<AtomicObservation>> byMetric;
    private final Map<String, CloseSeries> closeSeries = new ConcurrentHashMap<>();

    private EntityTimeline(String entityId, Map<String, List<AtomicObservation>> byMetric) {
        this.entityId = entityId;
        this.byMetric = byMetric;
    }

    public static EntityTimeline of(String entityId, List<AtomicObservation> observations) {
        Map<String, List<AtomicObservation>> grouped = new HashMap<>();
        if (observations != null) {
            for (AtomicObservation observation : observations) {
                if (observation == null || !observation.entityId.equals(entityId)) {
                    continue;
                }
                grouped.computeIfAbsent(observation.metricName, ignored -> new ArrayList<>()).add(observation);
            }
        }
        Map<String, List<AtomicObservation>> sorted = new HashMap<>();
        for (Map.Entry<String, List<AtomicObservation>> entry : grouped.entrySet()) {
            List<AtomicObservation> list = entry.getValue();
            list.sort(BY_REFERENCE);
            sorted.put(entry.getKey(), Collections.unmodifiableList(list));
        }
        return new EntityTimeline(entityId, sorted);
    }

    public String entityId() {
        return entityId;
    }

    public boolean hasMetric(String metricName) {
        List<AtomicObservation> list = byMetric.get(metricName);
        return list != null && !list.isEmpty();
    }

    /**
     * Observations of a metric with reference date on or before {@code asOf}, oldest first.
     */
    public List<AtomicObservation> history(String metricName, LocalDate asOf) {
        List<AtomicObservation> list = byMetric.get(metricName);
        if (list == null || list.isEmpty() || asOf == null) {
            return List.of();
        }
        return list.subList(0, upperBound(list, asOf));
    }

    /**
     * Full close series of a price metric, built on first use. Callers bound
     * their reads with {@link CloseSeries#countUpTo(LocalDate)}.
     */
    public CloseSeries closeSeries(String metricName) {
        return closeSeries.computeIfAbsent(metricName,
                name -> CloseSeries.of(byMetric.getOrDefault(name, List.of())));
    }

    // first index whose reference date is after asOf
    private static int upperBound(List<AtomicObservation> list, LocalDate asOf) {
        int lo = 0;
        int hi = list.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (list.get(mid).referenceDate().isAfter(asOf)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
