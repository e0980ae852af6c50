package com.factorbot.quality;

import com.factorbot.model.FactorObservation;
import com.factorbot.model.QualityFlag;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Clamps one factor to an upper cap computed across all entities of the same
 * observation date. Small cross-sections use a fixed cap instead of the
 * percentile. Rows are clamped, never dropped.
 */
public final class CrossSectionalCapper {
    private static final Logger LOG = LogManager.getLogger(CrossSectionalCapper.class);

    private final double percentile;
    private final int minSample;
    private final double fixedCap;

    public CrossSectionalCapper(double percentile, int minSample, double fixedCap) {
        this.percentile = percentile;
        this.minSample = Math.max(1, minSample);
        this.fixedCap = fixedCap;
    }

    /**
     * Caps {@code factorName} rows in {@code rows}; other factors pass through unchanged.
     * Must only be called once every entity's candidates have been collected.
     */
    public CapResult apply(String factorName, List<FactorObservation> rows) {
        Map<LocalDate, List<Double>> byDate = new TreeMap<>();
        for (FactorObservation row : rows) {
            if (factorName.equals(row.factorName) && row.factorValue != null) {
                byDate.computeIfAbsent(row.observationDate, ignored -> new ArrayList<>()).add(row.factorValue);
            }
        }
        Map<LocalDate, Double> caps = new TreeMap<>();
        for (Map.Entry<LocalDate, List<Double>> entry : byDate.entrySet()) {
            caps.put(entry.getKey(), capFor(entry.getValue()));
        }

        List<FactorObservation> out = new ArrayList<>(rows.size());
        List<FactorObservation> capped = new ArrayList<>();
        for (FactorObservation row : rows) {
            Double cap = factorName.equals(row.factorName) ? caps.get(row.observationDate) : null;
            if (cap != null && row.factorValue != null && row.factorValue > cap) {
                FactorObservation clamped = row.withValue(cap, QualityFlag.CAPPED);
                out.add(clamped);
                capped.add(clamped);
            } else {
                out.add(row);
            }
        }
        LOG.info("stage=cap factor={} periods={} capped={}", factorName, caps.size(), capped.size());
        return new CapResult(out, capped, caps);
    }

    /**
     * Cap for one cross-section: the configured percentile, or the fixed cap when
     * the sample is smaller than the minimum size.
     */
    public double capFor(List<Double> sample) {
        if (sample == null || sample.size() < minSample) {
            return fixedCap;
        }
        double[] sorted = new double[sample.size()];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = sample.get(i);
        }
        Arrays.sort(sorted);
        return percentile(sorted, percentile);
    }

    // linear interpolation between closest ranks
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = p * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double weight = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
    }

    public static final class CapResult {
        public final List<FactorObservation> rows;
        public final List<FactorObservation> capped;
        public final Map<LocalDate, Double> capsByDate;

        CapResult(List<FactorObservation> rows, List<FactorObservation> capped, Map<LocalDate, Double> capsByDate) {
            this.rows = Collections.unmodifiableList(rows);
            this.capped = Collections.unmodifiableList(capped);
            this.capsByDate = Collections.unmodifiableMap(capsByDate);
        }
    }
}
