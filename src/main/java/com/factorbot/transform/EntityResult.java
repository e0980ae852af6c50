package com.factorbot.transform;

import com.factorbot.model.FactorObservation;
import com.factorbot.quality.QualityTally;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one entity task. A failed entity carries no rows; its error is
 * reported in the run audit while other entities proceed.
 */
public final class EntityResult {
    public final String entityId;
    public final List<FactorObservation> rows;
    public final QualityTally tally;
    public final String error;

    private EntityResult(String entityId, List<FactorObservation> rows, QualityTally tally, String error) {
        this.entityId = entityId;
        this.rows = rows == null ? List.of() : Collections.unmodifiableList(rows);
        this.tally = tally == null ? new QualityTally() : tally;
        this.error = error;
    }

    public static EntityResult ok(String entityId, List<FactorObservation> rows, QualityTally tally) {
        return new EntityResult(entityId, rows, tally, null);
    }

    public static EntityResult failed(String entityId, String error) {
        return new EntityResult(entityId, List.of(), new QualityTally(), error == null || error.isBlank() ? "unknown error" : error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
