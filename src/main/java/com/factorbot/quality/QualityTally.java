package com.factorbot.quality;

import com.factorbot.model.FactorObservation;
import com.factorbot.model.QualityFlag;
import com.factorbot.model.QualityVerdict;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Quality counters for one unit of work (one entity, or a whole run after merging).
 * Not thread-safe: each entity task owns its own tally and the fan-in merges them.
 */
public final class QualityTally {
    private int evaluated;
    private int kept;
    private int dropped;
    private int staleCount;
    private int expiredCount;
    private int cappedCount;
    private final Map<String, Integer> dropReasons = new TreeMap<>();
    private final Map<String, Integer> flagCounts = new TreeMap<>();
    private final Map<String, Integer> keptPerFactor = new TreeMap<>();
    private final List<FlagEvent> flagEvents = new ArrayList<>();

    public void recordKept(FactorObservation row) {
        evaluated++;
        kept++;
        keptPerFactor.merge(row.factorName, 1, Integer::sum);
        for (QualityFlag flag : row.qualityFlags) {
            countFlag(flag);
            flagEvents.add(new FlagEvent(row.entityId, row.observationDate, row.factorName, flag.label(), true));
        }
    }

    public void recordDropped(String entityId, LocalDate date, String factorName, QualityVerdict verdict) {
        evaluated++;
        dropped++;
        dropReasons.merge(verdict.reason.isEmpty() ? "unspecified" : verdict.reason, 1, Integer::sum);
        for (QualityFlag flag : verdict.flags) {
            countFlag(flag);
            flagEvents.add(new FlagEvent(entityId, date, factorName, flag.label(), false));
        }
    }

    public void recordCapped(FactorObservation row) {
        cappedCount++;
        flagCounts.merge(QualityFlag.CAPPED.label(), 1, Integer::sum);
        flagEvents.add(new FlagEvent(row.entityId, row.observationDate, row.factorName, QualityFlag.CAPPED.label(), true));
    }

    public void merge(QualityTally other) {
        if (other == null) {
            return;
        }
        evaluated += other.evaluated;
        kept += other.kept;
        dropped += other.dropped;
        staleCount += other.staleCount;
        expiredCount += other.expiredCount;
        cappedCount += other.cappedCount;
        other.dropReasons.forEach((k, v) -> dropReasons.merge(k, v, Integer::sum));
        other.flagCounts.forEach((k, v) -> flagCounts.merge(k, v, Integer::sum));
        other.keptPerFactor.forEach((k, v) -> keptPerFactor.merge(k, v, Integer::sum));
        flagEvents.addAll(other.flagEvents);
    }

    private void countFlag(QualityFlag flag) {
        flagCounts.merge(flag.label(), 1, Integer::sum);
        if (flag == QualityFlag.STALE_PRICE || flag == QualityFlag.FINANCIAL_STALE) {
            staleCount++;
        } else if (flag == QualityFlag.DATA_EXPIRED) {
            expiredCount++;
        }
    }

    public int evaluated() {
        return evaluated;
    }

    public int kept() {
        return kept;
    }

    public int dropped() {
        return dropped;
    }

    public int staleCount() {
        return staleCount;
    }

    public int expiredCount() {
        return expiredCount;
    }

    public int cappedCount() {
        return cappedCount;
    }

    public Map<String, Integer> dropReasons() {
        return Collections.unmodifiableMap(dropReasons);
    }

    public Map<String, Integer> flagCounts() {
        return Collections.unmodifiableMap(flagCounts);
    }

    public Map<String, Integer> keptPerFactor() {
        return Collections.unmodifiableMap(keptPerFactor);
    }

    public List<FlagEvent> flagEvents() {
        return Collections.unmodifiableList(flagEvents);
    }

    /**
     * A flag raised on a candidate row, whether the row survived or not.
     */
    public record FlagEvent(String entityId, LocalDate observationDate, String factorName, String flag, boolean kept) {
    }
}
