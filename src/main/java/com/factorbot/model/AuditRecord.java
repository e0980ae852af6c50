package com.factorbot.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One row of the pipeline run audit.
 */
public final class AuditRecord {
    public final String runId;
    public final LocalDate runDate;
    public final Instant startedAt;
    public final Instant finishedAt;
    public final RunStatus status;
    public final String frequency;
    public final int backfillYears;
    public final int universeSize;
    public final int rowsWritten;
    public final String errorMessage;
    public final String notes;

    public AuditRecord(
            String runId,
            LocalDate runDate,
            Instant startedAt,
            Instant finishedAt,
            RunStatus status,
            String frequency,
            int backfillYears,
            int universeSize,
            int rowsWritten,
            String errorMessage,
            String notes
    ) {
        this.runId = runId;
        this.runDate = runDate;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.status = status == null ? RunStatus.FAILED : status;
        this.frequency = frequency == null ? "" : frequency;
        this.backfillYears = backfillYears;
        this.universeSize = Math.max(0, universeSize);
        this.rowsWritten = Math.max(0, rowsWritten);
        this.errorMessage = errorMessage == null ? "" : errorMessage;
        this.notes = notes == null ? "" : notes;
    }

    public static AuditRecord started(RunContext context, Instant startedAt, String notes) {
        return new AuditRecord(
                context.runId,
                context.runDate,
                startedAt,
                null,
                RunStatus.RUNNING,
                context.frequency.label(),
                context.backfillYears,
                context.universe.size(),
                0,
                "",
                notes
        );
    }

    public AuditRecord finished(Instant at, RunStatus finalStatus, int rows, String error, String finalNotes) {
        return new AuditRecord(
                runId,
                runDate,
                startedAt,
                at,
                finalStatus,
                frequency,
                backfillYears,
                universeSize,
                rows,
                error,
                finalNotes == null ? notes : finalNotes
        );
    }

    public boolean hasError() {
        return !errorMessage.isEmpty();
    }
}
