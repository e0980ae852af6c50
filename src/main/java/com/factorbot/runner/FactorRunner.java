package com.factorbot.runner;

import com.factorbot.audit.AuditRecorder;
import com.factorbot.config.EngineSettings;
import com.factorbot.core.RunTelemetry;
import com.factorbot.factor.FactorRuleRegistry;
import com.factorbot.model.AtomicObservation;
import com.factorbot.model.AuditRecord;
import com.factorbot.model.RunContext;
import com.factorbot.model.RunStatus;
import com.factorbot.normalize.AtomicNormalizer;
import com.factorbot.normalize.NormalizeResult;
import com.factorbot.quality.QualityReport;
import com.factorbot.quality.QualityTally;
import com.factorbot.transform.EngineResult;
import com.factorbot.transform.FactorEngine;
import com.factorbot.writer.FactorStore;
import com.factorbot.writer.UpsertWriter;
import com.factorbot.writer.WriteResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * One factor run end to end: open the audit row, normalize or load atomics,
 * optionally ingest them, transform, write, and close the audit row with the
 * outcome. Every path after the audit row is opened closes it.
 *
 * <p>Rows from entities that succeeded are written even when other entities
 * failed; the audit error text lists the failures.</p>
 */
public final class FactorRunner {
    private static final Logger LOG = LogManager.getLogger(FactorRunner.class);

    private final EngineSettings settings;
    private final FactorEngine engine;
    private final UpsertWriter writer;
    private final AuditRecorder audit;
    private final AtomicNormalizer normalizer = new AtomicNormalizer();
    private AtomicSink atomicSink;

    public FactorRunner(EngineSettings settings, FactorRuleRegistry registry, FactorStore store, AuditRecorder audit) {
        this.settings = settings;
        this.engine = new FactorEngine(registry, settings);
        this.writer = new UpsertWriter(store, settings.writerBatchSize);
        this.audit = audit;
    }

    /**
     * Persists normalized atomics before transforming them.
     */
    public FactorRunner withAtomicSink(AtomicSink sink) {
        this.atomicSink = sink;
        return this;
    }

    public FactorRunOutcome run(RunContext context, Iterable<JSONObject> records) {
        AuditRecord started = audit.start(context, "threads=" + settings.threads);
        RunTelemetry telemetry = new RunTelemetry(context.runId, context.frequency.label(), started.startedAt);
        try {
            telemetry.startStep(RunTelemetry.STEP_NORMALIZE);
            NormalizeResult normalized;
            try {
                normalized = normalizer.normalize(records);
            } catch (RuntimeException e) {
                telemetry.endStep(RunTelemetry.STEP_NORMALIZE, 0, 0, 1, e.getMessage());
                return fail(started, telemetry, null, "normalize failed: " + describe(e), e);
            }
            telemetry.endStep(RunTelemetry.STEP_NORMALIZE, normalized.inputCount, normalized.observations.size(), normalized.droppedCount());
            return execute(context, started, telemetry, normalized);
        } catch (RuntimeException e) {
            return fail(started, telemetry, null, "run failed: " + describe(e), e);
        }
    }

    /**
     * Runs on atomics that are already canonical. The audit row is opened
     * before the source is read, so a load failure still closes it as failed.
     */
    public FactorRunOutcome runFromSource(RunContext context, AtomicSource source) {
        AuditRecord started = audit.start(context, "threads=" + settings.threads);
        RunTelemetry telemetry = new RunTelemetry(context.runId, context.frequency.label(), started.startedAt);
        try {
            telemetry.startStep(RunTelemetry.STEP_LOAD);
            List<AtomicObservation> loaded;
            try {
                loaded = source.load(context);
            } catch (SQLException e) {
                telemetry.endStep(RunTelemetry.STEP_LOAD, 0, 0, 1, e.getMessage());
                return fail(started, telemetry, null, "load failed: " + describe(e), e);
            }
            List<AtomicObservation> atomics = loaded == null ? List.of() : loaded;
            telemetry.endStep(RunTelemetry.STEP_LOAD, 0, atomics.size(), 0);
            NormalizeResult normalized = new NormalizeResult(atomics, atomics.size(), Map.of(), 0, 0);
            return execute(context, started, telemetry, normalized);
        } catch (RuntimeException e) {
            return fail(started, telemetry, null, "run failed: " + describe(e), e);
        }
    }

    private FactorRunOutcome execute(RunContext context, AuditRecord started, RunTelemetry telemetry, NormalizeResult normalized) {
        LOG.info("stage=run run_id={} context={}", context.runId, context);
        if (atomicSink != null) {
            telemetry.startStep(RunTelemetry.STEP_INGEST);
            try {
                int ingested = atomicSink.ingest(normalized.observations);
                telemetry.endStep(RunTelemetry.STEP_INGEST, normalized.observations.size(), ingested, 0);
            } catch (SQLException e) {
                telemetry.endStep(RunTelemetry.STEP_INGEST, normalized.observations.size(), 0, 1, e.getMessage());
                return fail(started, telemetry, QualityReport.of(normalized, null, null), "ingest failed: " + describe(e), e);
            }
        }

        telemetry.startStep(RunTelemetry.STEP_TRANSFORM);
        EngineResult result;
        try {
            result = engine.run(context, normalized.observations);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            telemetry.endStep(RunTelemetry.STEP_TRANSFORM, normalized.observations.size(), 0, 1, "interrupted");
            return fail(started, telemetry, QualityReport.of(normalized, null, null), "run interrupted", e);
        } catch (RuntimeException e) {
            telemetry.endStep(RunTelemetry.STEP_TRANSFORM, normalized.observations.size(), 0, 1, e.getMessage());
            return fail(started, telemetry, QualityReport.of(normalized, null, null), "transform failed: " + describe(e), e);
        }
        telemetry.endStep(
                RunTelemetry.STEP_TRANSFORM,
                normalized.observations.size(),
                result.rows.size(),
                result.entityFailures.size(),
                "entities=" + result.entityCount + " dropped=" + result.tally.dropped()
        );
        QualityReport report = QualityReport.of(normalized, result.tally, result.entityFailures);

        telemetry.startStep(RunTelemetry.STEP_WRITE);
        WriteResult written = writer.write(result.rows, context.runId);
        telemetry.endStep(RunTelemetry.STEP_WRITE, result.rows.size(), written.rowsWritten, written.failed() ? 1 : 0,
                "batches=" + written.batches);

        RunStatus status = written.failed() ? RunStatus.FAILED : RunStatus.SUCCESS;
        String error = errorText(written, result.entityFailures);
        telemetry.finish();
        AuditRecord finished = audit.finish(started, status, written.rowsWritten, error, report.summary());
        LOG.info("stage=run run_id={} status={} {}", context.runId, status.label(), report.summary());
        LOG.info("run summary\n{}", telemetry.getSummary());
        return new FactorRunOutcome(finished, report, result.rows, telemetry);
    }

    private FactorRunOutcome fail(AuditRecord started, RunTelemetry telemetry, QualityReport report, String error, Exception cause) {
        LOG.error("stage=run run_id={} failed: {}", started.runId, error, cause);
        telemetry.finish();
        QualityReport safeReport = report == null ? QualityReport.of(null, new QualityTally(), null) : report;
        AuditRecord finished = audit.finish(started, RunStatus.FAILED, 0, error, safeReport.summary());
        return new FactorRunOutcome(finished, safeReport, List.of(), telemetry);
    }

    static String errorText(WriteResult written, Map<String, String> entityFailures) {
        StringJoiner parts = new StringJoiner(" | ");
        if (written != null && written.failed()) {
            parts.add("write failed after " + written.rowsWritten + " rows: " + describe(written.failure));
        }
        if (entityFailures != null && !entityFailures.isEmpty()) {
            StringJoiner entities = new StringJoiner("; ");
            for (Map.Entry<String, String> entry : entityFailures.entrySet()) {
                entities.add(entry.getKey() + "=" + entry.getValue());
            }
            parts.add("entity_failures=" + entityFailures.size() + ": " + entities);
        }
        return parts.toString();
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
