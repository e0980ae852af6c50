package com.factorbot.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable per-run context threaded through every stage.
 */
public final class RunContext {
    private static final DateTimeFormatter RUN_ID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public final String runId;
    public final LocalDate runDate;
    public final MetricFrequency frequency;
    public final int backfillYears;
    public final List<String> universe;

    public RunContext(String runId, LocalDate runDate, MetricFrequency frequency, int backfillYears, List<String> universe) {
        this.runDate = Objects.requireNonNull(runDate, "runDate");
        this.runId = runId == null || runId.isBlank() ? newRunId(runDate) : runId.trim();
        this.frequency = frequency == null ? MetricFrequency.MONTHLY : frequency;
        this.backfillYears = Math.max(1, backfillYears);
        this.universe = normalizeUniverse(universe);
    }

    public static String newRunId(LocalDate runDate) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return "run_" + RUN_ID_DATE.format(runDate) + "_" + suffix;
    }

    /**
     * First date of the output window.
     */
    public LocalDate windowStart() {
        long lookbackDays = Math.max(1L, Math.round(365.25 * backfillYears));
        return runDate.minusDays(lookbackDays);
    }

    /**
     * First date of atomic history that may feed the window.
     */
    public LocalDate dataStart(int paddingDays) {
        return windowStart().minusDays(Math.max(0, paddingDays));
    }

    /**
     * Whether the entity is in scope; an empty universe means "all".
     */
    public boolean inUniverse(String entityId) {
        return universe.isEmpty() || (entityId != null && universe.contains(entityId.trim().toUpperCase(Locale.ROOT)));
    }

    private static List<String> normalizeUniverse(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String item : raw) {
            if (item == null || item.trim().isEmpty()) {
                continue;
            }
            out.add(item.trim().toUpperCase(Locale.ROOT));
        }
        return Collections.unmodifiableList(new ArrayList<>(out));
    }

    @Override
    public String toString() {
        return "RunContext{run_id=" + runId + ", run_date=" + runDate + ", frequency=" + frequency.label()
                + ", backfill_years=" + backfillYears + ", universe=" + universe.size() + "}";
    }
}
