package com.factorbot.db;

import com.factorbot.db.mybatis.FactorObservationMapper;
import com.factorbot.db.mybatis.FactorObservationParam;
import com.factorbot.db.mybatis.MyBatisSupport;
import com.factorbot.model.FactorObservation;
import com.factorbot.writer.FactorStore;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * {@link FactorStore} over the {@code factor_observations} table. Each batch
 * runs in one transaction and relies on the table's unique constraint for
 * conflict resolution.
 */
public final class PostgresFactorStore implements FactorStore {
    private final Database database;

    public PostgresFactorStore(Database database) {
        this.database = database;
    }

    @Override
    public int upsert(List<FactorObservation> rows, String runId) throws SQLException {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            FactorObservationMapper mapper = session.getMapper(FactorObservationMapper.class);
            int affected = 0;
            try {
                for (FactorObservation row : rows) {
                    mapper.upsertFactor(toParam(row, runId, now));
                    affected++;
                }
                conn.commit();
            } catch (PersistenceException e) {
                conn.rollback();
                throw new SQLException("factor upsert failed after " + affected + " rows: " + e.getMessage(), e);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            return affected;
        }
    }

    static FactorObservationParam toParam(FactorObservation row, String runId, OffsetDateTime now) {
        return FactorObservationParam.builder()
                .symbol(row.entityId)
                .observationDate(row.observationDate)
                .factorName(row.factorName)
                .factorValue(row.factorValue)
                .source(row.source)
                .metricFrequency(row.frequency.label())
                .sourceReportDate(row.sourceReportDate)
                .qualityFlags(row.flagsText())
                .runId(runId)
                .updatedAt(now)
                .build();
    }
}
