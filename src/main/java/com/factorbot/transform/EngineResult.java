package com.factorbot.transform;

import com.factorbot.model.FactorObservation;
import com.factorbot.quality.QualityTally;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Fan-in of all entity tasks after the cross-sectional cap barrier.
 */
public final class EngineResult {
    public final List<FactorObservation> rows;
    public final QualityTally tally;
    public final Map<String, String> entityFailures;
    public final int entityCount;

    public EngineResult(List<FactorObservation> rows, QualityTally tally, Map<String, String> entityFailures, int entityCount) {
        this.rows = Collections.unmodifiableList(rows);
        this.tally = tally;
        this.entityFailures = Collections.unmodifiableMap(entityFailures);
        this.entityCount = entityCount;
    }

    public boolean hasFailures() {
        return !entityFailures.isEmpty();
    }
}
