package com.factorbot.factor;

import com.factorbot.align.EntityTimeline;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityVerdict;

import java.time.LocalDate;

/**
 * One curated factor: how its inputs are aligned, when a candidate is kept or
 * dropped, and how its value is computed.
 *
 * <p>{@link #judge} and {@link #compute} are pure functions of the aligned
 * inputs. {@link #compute} is only called for kept candidates.</p>
 */
public interface FactorRule {

    String factorName();

    /**
     * Grid the factor is evaluated on. {@link MetricFrequency#DAILY} means the
     * entity's own trading dates.
     */
    MetricFrequency gridFrequency();

    /**
     * Whether the entity has any input this rule reads; entities without one are skipped.
     */
    boolean appliesTo(EntityTimeline timeline);

    AlignedInputs align(RuleEnvironment env, EntityTimeline timeline, LocalDate asOf);

    QualityVerdict judge(RuleEnvironment env, AlignedInputs inputs);

    double compute(AlignedInputs inputs);

    default LocalDate sourceReportDate(AlignedInputs inputs) {
        return inputs.latestReferenceDate();
    }

    /**
     * Rows of this factor are clamped cross-sectionally after all entities finish.
     */
    default boolean crossSectionalCap() {
        return false;
    }
}
