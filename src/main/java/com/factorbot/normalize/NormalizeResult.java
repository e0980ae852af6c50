package com.factorbot.normalize;

import com.factorbot.model.AtomicObservation;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Output of one normalization pass: the canonical observations plus the
 * counts of what was rejected and why.
 */
public final class NormalizeResult {
    public static final String MISSING_ENTITY_ID = "missing_entity_id";
    public static final String MISSING_OBSERVATION_DATE = "missing_observation_date";
    public static final String MISSING_METRIC_NAME = "missing_metric_name";
    public static final String NULL_RECORD = "null_record";

    public final List<AtomicObservation> observations;
    public final int inputCount;
    public final Map<String, Integer> droppedByReason;
    public final int nullValueCount;
    public final int duplicateKeyCount;

    public NormalizeResult(
            List<AtomicObservation> observations,
            int inputCount,
            Map<String, Integer> droppedByReason,
            int nullValueCount,
            int duplicateKeyCount
    ) {
        this.observations = observations == null ? List.of() : Collections.unmodifiableList(observations);
        this.inputCount = Math.max(0, inputCount);
        this.droppedByReason = droppedByReason == null ? Map.of() : Collections.unmodifiableMap(droppedByReason);
        this.nullValueCount = Math.max(0, nullValueCount);
        this.duplicateKeyCount = Math.max(0, duplicateKeyCount);
    }

    public int droppedCount() {
        int total = 0;
        for (int count : droppedByReason.values()) {
            total += count;
        }
        return total;
    }
}
