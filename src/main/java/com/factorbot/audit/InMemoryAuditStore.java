package com.factorbot.audit;

import com.factorbot.model.AuditRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryAuditStore implements AuditStore {
    private final Map<String, AuditRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void insertStarted(AuditRecord record) {
        records.put(record.runId, record);
    }

    @Override
    public synchronized void updateFinished(AuditRecord record) {
        records.put(record.runId, record);
    }

    @Override
    public synchronized Optional<AuditRecord> find(String runId) {
        return Optional.ofNullable(records.get(runId));
    }

    public synchronized List<AuditRecord> all() {
        return new ArrayList<>(records.values());
    }
}
