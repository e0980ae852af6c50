package com.factorbot.writer;

import com.factorbot.model.FactorObservation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map-backed store used for dry runs and tests. Same key semantics as the
 * database table.
 */
public final class InMemoryFactorStore implements FactorStore {
    private final Map<FactorObservation.FactorKey, FactorObservation> rows = new LinkedHashMap<>();
    private final Map<FactorObservation.FactorKey, String> runIds = new LinkedHashMap<>();

    @Override
    public synchronized int upsert(List<FactorObservation> batch, String runId) {
        for (FactorObservation row : batch) {
            rows.put(row.key(), row);
            runIds.put(row.key(), runId);
        }
        return batch.size();
    }

    public synchronized FactorObservation get(String entityId, LocalDate date, String factorName) {
        return rows.get(new FactorObservation.FactorKey(entityId, date, factorName));
    }

    public synchronized String runIdOf(FactorObservation.FactorKey key) {
        return runIds.get(key);
    }

    public synchronized List<FactorObservation> rows() {
        return new ArrayList<>(rows.values());
    }

    public synchronized int size() {
        return rows.size();
    }

}
