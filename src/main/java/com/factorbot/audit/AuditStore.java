package com.factorbot.audit;

import com.factorbot.model.AuditRecord;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Pipeline run audit table, one row per run id.
 */
public interface AuditStore {

    void insertStarted(AuditRecord record) throws SQLException;

    void updateFinished(AuditRecord record) throws SQLException;

    Optional<AuditRecord> find(String runId) throws SQLException;
}
