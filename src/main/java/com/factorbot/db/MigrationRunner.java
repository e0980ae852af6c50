package com.factorbot.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration runner for the factor tables and the run audit.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
                LOG.info("stage=migrate schema={} version={}->{}", schema, currentVersion, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS factor_observations (" +
                "id BIGSERIAL PRIMARY KEY," +
                "symbol TEXT NOT NULL," +
                "observation_date DATE NOT NULL," +
                "factor_name TEXT NOT NULL," +
                "factor_value DOUBLE PRECISION NULL," +
                "source TEXT NOT NULL," +
                "metric_frequency TEXT NOT NULL DEFAULT 'unknown'," +
                "source_report_date DATE NULL," +
                "quality_flags TEXT NOT NULL DEFAULT ''," +
                "run_id TEXT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "CONSTRAINT uq_factor_observations UNIQUE (symbol, observation_date, factor_name)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS financial_observations (" +
                "id BIGSERIAL PRIMARY KEY," +
                "symbol TEXT NOT NULL," +
                "report_date DATE NOT NULL," +
                "metric_name TEXT NOT NULL," +
                "metric_value DOUBLE PRECISION NULL," +
                "currency TEXT NULL," +
                "period_type TEXT NOT NULL DEFAULT 'unknown'," +
                "metric_definition TEXT NULL," +
                "source TEXT NOT NULL," +
                "as_of DATE NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "CONSTRAINT uq_financial_observations UNIQUE (symbol, report_date, metric_name)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS pipeline_runs (" +
                "run_id TEXT PRIMARY KEY," +
                "run_date DATE NOT NULL," +
                "started_at TIMESTAMPTZ NOT NULL," +
                "finished_at TIMESTAMPTZ NULL," +
                "status TEXT NOT NULL CHECK (status IN ('running','success','failed'))," +
                "frequency TEXT NULL," +
                "backfill_years INTEGER NULL," +
                "company_limit INTEGER NULL," +
                "rows_written INTEGER NOT NULL DEFAULT 0," +
                "error_message TEXT NULL," +
                "notes TEXT NULL" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_factor_observations_name_date ON factor_observations(factor_name, observation_date)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_factor_observations_symbol_date ON factor_observations(symbol, observation_date DESC)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_financial_observations_symbol_date ON financial_observations(symbol, report_date DESC)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_pipeline_runs_started ON pipeline_runs(started_at DESC)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && !value.trim().isEmpty()) {
                    return Integer.parseInt(value.trim());
                }
            }
        } catch (SQLException | NumberFormatException e) {
            LOG.warn("stage=migrate unreadable schema_version, assuming 0: {}", e.getMessage());
            return 0;
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
