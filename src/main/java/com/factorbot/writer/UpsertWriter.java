package com.factorbot.writer;

import com.factorbot.model.FactorObservation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes curated rows idempotently. Rows sharing a key are collapsed before
 * writing (the last one wins), then sent to the store in fixed-size batches.
 * The first rejected batch stops the write. A driver or mapper exception
 * counts as a rejection.
 */
public final class UpsertWriter {
    private static final Logger LOG = LogManager.getLogger(UpsertWriter.class);

    private final FactorStore store;
    private final int batchSize;

    public UpsertWriter(FactorStore store, int batchSize) {
        this.store = store;
        this.batchSize = Math.max(1, batchSize);
    }

    public WriteResult write(List<FactorObservation> rows, String runId) {
        List<FactorObservation> unique = dedupe(rows);
        int collapsed = (rows == null ? 0 : rows.size()) - unique.size();
        int written = 0;
        int batches = 0;
        for (int from = 0; from < unique.size(); from += batchSize) {
            List<FactorObservation> batch = unique.subList(from, Math.min(unique.size(), from + batchSize));
            try {
                written += store.upsert(batch, runId);
                batches++;
            } catch (SQLException | RuntimeException e) {
                LOG.error("stage=write run_id={} aborted at batch={} committed_rows={}: {}",
                        runId, batches + 1, written, e.getMessage(), e);
                return new WriteResult(unique.size(), written, collapsed, batches, e);
            }
        }
        LOG.info("stage=write run_id={} in={} out={} duplicates={} batches={}",
                runId, rows == null ? 0 : rows.size(), written, collapsed, batches);
        return new WriteResult(unique.size(), written, collapsed, batches, null);
    }

    static List<FactorObservation> dedupe(List<FactorObservation> rows) {
        Map<FactorObservation.FactorKey, FactorObservation> byKey = new LinkedHashMap<>();
        if (rows != null) {
            for (FactorObservation row : rows) {
                if (row != null) {
                    byKey.put(row.key(), row);
                }
            }
        }
        return new ArrayList<>(byKey.values());
    }
}
