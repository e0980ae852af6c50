package com.factorbot.quality;

import com.factorbot.normalize.NormalizeResult;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate quality report of one run, built after the fan-in.
 */
public final class QualityReport {
    public final int inputRecords;
    public final int normalizedRecords;
    public final Map<String, Integer> malformedByReason;
    public final int nullValueAtomics;
    public final int duplicateAtomicKeys;
    public final int evaluated;
    public final int kept;
    public final int dropped;
    public final Map<String, Integer> dropReasons;
    public final Map<String, Integer> flagCounts;
    public final Map<String, Integer> keptPerFactor;
    public final int staleCount;
    public final int expiredCount;
    public final int cappedCount;
    public final Map<String, String> entityFailures;
    public final List<QualityTally.FlagEvent> flags;

    private QualityReport(NormalizeResult normalized, QualityTally tally, Map<String, String> entityFailures) {
        this.inputRecords = normalized == null ? 0 : normalized.inputCount;
        this.normalizedRecords = normalized == null ? 0 : normalized.observations.size();
        this.malformedByReason = normalized == null ? Map.of() : normalized.droppedByReason;
        this.nullValueAtomics = normalized == null ? 0 : normalized.nullValueCount;
        this.duplicateAtomicKeys = normalized == null ? 0 : normalized.duplicateKeyCount;
        this.evaluated = tally.evaluated();
        this.kept = tally.kept();
        this.dropped = tally.dropped();
        this.dropReasons = tally.dropReasons();
        this.flagCounts = tally.flagCounts();
        this.keptPerFactor = tally.keptPerFactor();
        this.staleCount = tally.staleCount();
        this.expiredCount = tally.expiredCount();
        this.cappedCount = tally.cappedCount();
        this.entityFailures = entityFailures == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(entityFailures));
        this.flags = tally.flagEvents();
    }

    public static QualityReport of(NormalizeResult normalized, QualityTally tally, Map<String, String> entityFailures) {
        return new QualityReport(normalized, tally == null ? new QualityTally() : tally, entityFailures);
    }

    public int droppedFor(String reason) {
        return dropReasons.getOrDefault(reason, 0);
    }

    public int flagged(String flagLabel) {
        return flagCounts.getOrDefault(flagLabel, 0);
    }

    /**
     * One-line summary for the run log and the audit notes.
     */
    public String summary() {
        return "normalized=" + normalizedRecords
                + " malformed=" + (inputRecords - normalizedRecords)
                + " evaluated=" + evaluated
                + " kept=" + kept
                + " dropped=" + dropped
                + " stale=" + staleCount
                + " expired=" + expiredCount
                + " capped=" + cappedCount
                + " entity_failures=" + entityFailures.size();
    }

    public JSONObject toJson() {
        JSONObject normalize = new JSONObject();
        normalize.put("input_records", inputRecords);
        normalize.put("normalized_records", normalizedRecords);
        normalize.put("malformed", new JSONObject(malformedByReason));
        normalize.put("null_value_atomics", nullValueAtomics);
        normalize.put("duplicate_atomic_keys", duplicateAtomicKeys);

        JSONObject quality = new JSONObject();
        quality.put("evaluated", evaluated);
        quality.put("kept", kept);
        quality.put("dropped", dropped);
        quality.put("drop_reasons", new JSONObject(dropReasons));
        quality.put("flag_counts", new JSONObject(flagCounts));
        quality.put("kept_per_factor", new JSONObject(keptPerFactor));
        quality.put("stale", staleCount);
        quality.put("expired", expiredCount);
        quality.put("capped", cappedCount);

        JSONArray flagList = new JSONArray();
        for (QualityTally.FlagEvent event : flags) {
            JSONObject item = new JSONObject();
            item.put("entity_id", event.entityId());
            item.put("observation_date", event.observationDate().toString());
            item.put("factor_name", event.factorName());
            item.put("flag", event.flag());
            item.put("kept", event.kept());
            flagList.put(item);
        }

        JSONObject root = new JSONObject();
        root.put("normalize", normalize);
        root.put("quality", quality);
        root.put("entity_failures", new JSONObject(entityFailures));
        root.put("flags", flagList);
        return root;
    }
}
