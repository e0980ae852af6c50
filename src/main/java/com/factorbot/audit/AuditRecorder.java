package com.factorbot.audit;

import com.factorbot.model.AuditRecord;
import com.factorbot.model.RunContext;
import com.factorbot.model.RunStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;

/**
 * Opens and closes the audit row of a run. Audit storage problems are logged
 * and never mask the run's own outcome.
 */
public final class AuditRecorder {
    private static final Logger LOG = LogManager.getLogger(AuditRecorder.class);
    private static final int MAX_ERROR_LENGTH = 4000;

    private final AuditStore store;
    private final Clock clock;

    public AuditRecorder(AuditStore store) {
        this(store, Clock.systemUTC());
    }

    public AuditRecorder(AuditStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public AuditRecord start(RunContext context, String notes) {
        AuditRecord record = AuditRecord.started(context, Instant.now(clock), notes);
        try {
            store.insertStarted(record);
            LOG.info("stage=audit run_id={} status={} run_date={}", record.runId, record.status.label(), record.runDate);
        } catch (SQLException e) {
            LOG.error("stage=audit run_id={} failed to insert running row: {}", record.runId, e.getMessage(), e);
        }
        return record;
    }

    public AuditRecord finish(AuditRecord started, RunStatus status, int rowsWritten, String error, String notes) {
        AuditRecord record = started.finished(Instant.now(clock), status, rowsWritten, truncate(error), notes);
        try {
            store.updateFinished(record);
            LOG.info("stage=audit run_id={} status={} rows_written={} error={}",
                    record.runId, record.status.label(), record.rowsWritten, record.hasError() ? record.errorMessage : "-");
        } catch (SQLException | RuntimeException e) {
            LOG.error("stage=audit run_id={} failed to record final status={}: {}",
                    record.runId, status.label(), e.getMessage(), e);
        }
        return record;
    }

    static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH);
    }
}
