package com.factorbot.runner;

import com.factorbot.core.RunTelemetry;
import com.factorbot.model.AuditRecord;
import com.factorbot.model.FactorObservation;
import com.factorbot.model.RunStatus;
import com.factorbot.quality.QualityReport;

import java.util.Collections;
import java.util.List;

/**
 * Everything one run produced: the final audit row, the quality report, the
 * curated rows handed to the writer and the step telemetry.
 */
public final class FactorRunOutcome {
    public final AuditRecord audit;
    public final QualityReport report;
    public final List<FactorObservation> rows;
    public final RunTelemetry telemetry;

    FactorRunOutcome(AuditRecord audit, QualityReport report, List<FactorObservation> rows, RunTelemetry telemetry) {
        this.audit = audit;
        this.report = report;
        this.rows = rows == null ? List.of() : Collections.unmodifiableList(rows);
        this.telemetry = telemetry;
    }

    public RunStatus status() {
        return audit.status;
    }

    public boolean succeeded() {
        return audit.status == RunStatus.SUCCESS;
    }

    public int rowsWritten() {
        return audit.rowsWritten;
    }
}
