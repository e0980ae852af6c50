package com.factorbot.writer;

import com.factorbot.model.FactorObservation;

import java.sql.SQLException;
import java.util.List;

/**
 * Long-table store of factor rows, unique on (entity, observation date, factor name).
 * Writing an existing key overwrites it in place.
 */
public interface FactorStore {

    /**
     * Upserts one batch and returns the number of rows affected. The batch is
     * either fully applied or not at all.
     */
    int upsert(List<FactorObservation> rows, String runId) throws SQLException;
}
