package com.factorbot.db;

import com.factorbot.db.mybatis.FactorObservationMapper;
import com.factorbot.db.mybatis.FactorObservationParam;
import com.factorbot.db.mybatis.FactorObservationRow;
import com.factorbot.db.mybatis.FinancialObservationMapper;
import com.factorbot.db.mybatis.FinancialObservationParam;
import com.factorbot.db.mybatis.FinancialObservationRow;
import com.factorbot.db.mybatis.MyBatisSupport;
import com.factorbot.factor.Metrics;
import com.factorbot.model.AtomicObservation;
import com.factorbot.model.MetricFrequency;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Persists and reloads atomic observations. Financial metrics live in
 * {@code financial_observations} keyed by report date; market and alternative
 * metrics share {@code factor_observations} with the curated factors.
 */
public final class AtomicObservationDao {
    private static final Logger LOG = LogManager.getLogger(AtomicObservationDao.class);

    private final Database database;

    public AtomicObservationDao(Database database) {
        this.database = database;
    }

    public int ingest(List<AtomicObservation> observations) throws SQLException {
        if (observations == null || observations.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        int financial = 0;
        int other = 0;
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            FinancialObservationMapper financialMapper = session.getMapper(FinancialObservationMapper.class);
            FactorObservationMapper factorMapper = session.getMapper(FactorObservationMapper.class);
            try {
                for (AtomicObservation observation : observations) {
                    if (Metrics.isFinancial(observation.metricName)) {
                        financialMapper.upsertFinancial(toFinancialParam(observation, now));
                        financial++;
                    } else {
                        factorMapper.upsertFactor(toFactorParam(observation, now));
                        other++;
                    }
                }
                conn.commit();
            } catch (PersistenceException e) {
                conn.rollback();
                throw new SQLException("atomic ingest failed: " + e.getMessage(), e);
            }
        }
        LOG.info("stage=ingest financial_rows={} market_alt_rows={}", financial, other);
        return financial + other;
    }

    /**
     * Atomics with reference date in {@code [from, to]}; an empty symbol list loads every entity.
     */
    public List<AtomicObservation> load(List<String> symbols, LocalDate from, LocalDate to) throws SQLException {
        List<String> atomicNames = new ArrayList<>(new TreeSet<>(Metrics.MARKET));
        atomicNames.addAll(new TreeSet<>(Metrics.ALTERNATIVE));
        List<AtomicObservation> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<String> scope = symbols == null ? List.of() : symbols;
            for (FactorObservationRow row : session.getMapper(FactorObservationMapper.class)
                    .selectRange(scope, atomicNames, from, to)) {
                out.add(fromFactorRow(row));
            }
            for (FinancialObservationRow row : session.getMapper(FinancialObservationMapper.class)
                    .selectRange(scope, from, to)) {
                out.add(fromFinancialRow(row));
            }
        } catch (PersistenceException e) {
            throw new SQLException("atomic load failed: " + e.getMessage(), e);
        }
        LOG.info("stage=load from={} to={} symbols={} rows={}", from, to, symbols == null ? 0 : symbols.size(), out.size());
        return out;
    }

    static FinancialObservationParam toFinancialParam(AtomicObservation observation, OffsetDateTime now) {
        return FinancialObservationParam.builder()
                .symbol(observation.entityId)
                .reportDate(observation.referenceDate())
                .metricName(observation.metricName)
                .metricValue(observation.value)
                .periodType(observation.frequency.label())
                .source(observation.source)
                .asOf(observation.observationDate)
                .updatedAt(now)
                .build();
    }

    static FactorObservationParam toFactorParam(AtomicObservation observation, OffsetDateTime now) {
        return FactorObservationParam.builder()
                .symbol(observation.entityId)
                .observationDate(observation.observationDate)
                .factorName(observation.metricName)
                .factorValue(observation.value)
                .source(observation.source)
                .metricFrequency(observation.frequency.label())
                .sourceReportDate(observation.reportReferenceDate)
                .qualityFlags("")
                .updatedAt(now)
                .build();
    }

    static AtomicObservation fromFinancialRow(FinancialObservationRow row) {
        LocalDate observed = row.getAsOf() == null ? row.getReportDate() : row.getAsOf();
        return new AtomicObservation(
                row.getSymbol(),
                observed,
                row.getMetricName(),
                row.getMetricValue(),
                row.getSource(),
                MetricFrequency.fromLabel(row.getPeriodType()),
                row.getReportDate()
        );
    }

    static AtomicObservation fromFactorRow(FactorObservationRow row) {
        return new AtomicObservation(
                row.getSymbol(),
                row.getObservationDate(),
                row.getFactorName(),
                row.getFactorValue(),
                row.getSource(),
                MetricFrequency.fromLabel(row.getMetricFrequency()),
                row.getSourceReportDate()
        );
    }
}
