package com.factorbot.db;

import com.factorbot.audit.AuditStore;
import com.factorbot.db.mybatis.MyBatisSupport;
import com.factorbot.db.mybatis.PipelineRunMapper;
import com.factorbot.db.mybatis.PipelineRunParam;
import com.factorbot.db.mybatis.PipelineRunRow;
import com.factorbot.model.AuditRecord;
import com.factorbot.model.RunStatus;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * DAO for the {@code pipeline_runs} audit table.
 */
public final class PostgresAuditStore implements AuditStore {
    private final Database database;

    public PostgresAuditStore(Database database) {
        this.database = database;
    }

    @Override
    public void insertStarted(AuditRecord record) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(PipelineRunMapper.class).insertRun(toParam(record));
            conn.commit();
        } catch (PersistenceException e) {
            throw new SQLException("pipeline_runs insert failed run_id=" + record.runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void updateFinished(AuditRecord record) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int updated = session.getMapper(PipelineRunMapper.class).updateRunFinish(toParam(record));
            if (updated == 0) {
                session.getMapper(PipelineRunMapper.class).insertRun(toParam(record));
                session.getMapper(PipelineRunMapper.class).updateRunFinish(toParam(record));
            }
            conn.commit();
        } catch (PersistenceException e) {
            throw new SQLException("pipeline_runs update failed run_id=" + record.runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<AuditRecord> find(String runId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            PipelineRunRow row = session.getMapper(PipelineRunMapper.class).findById(runId);
            return Optional.ofNullable(row).map(PostgresAuditStore::fromRow);
        } catch (PersistenceException e) {
            throw new SQLException("pipeline_runs lookup failed run_id=" + runId + ": " + e.getMessage(), e);
        }
    }

    static PipelineRunParam toParam(AuditRecord record) {
        return PipelineRunParam.builder()
                .runId(record.runId)
                .runDate(record.runDate)
                .startedAt(toOffset(record.startedAt))
                .finishedAt(toOffset(record.finishedAt))
                .status(record.status.label())
                .frequency(record.frequency)
                .backfillYears(record.backfillYears)
                .companyLimit(record.universeSize)
                .rowsWritten(record.rowsWritten)
                .errorMessage(record.errorMessage.isEmpty() ? null : record.errorMessage)
                .notes(record.notes)
                .build();
    }

    static AuditRecord fromRow(PipelineRunRow row) {
        return new AuditRecord(
                row.getRunId(),
                row.getRunDate(),
                toInstant(row.getStartedAt()),
                toInstant(row.getFinishedAt()),
                RunStatus.fromLabel(row.getStatus()),
                row.getFrequency(),
                row.getBackfillYears() == null ? 0 : row.getBackfillYears(),
                row.getCompanyLimit() == null ? 0 : row.getCompanyLimit(),
                row.getRowsWritten() == null ? 0 : row.getRowsWritten(),
                row.getErrorMessage(),
                row.getNotes()
        );
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
