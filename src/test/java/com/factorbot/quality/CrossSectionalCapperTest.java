package com.factorbot.quality;

import com.factorbot.model.FactorObservation;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityFlag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrossSectionalCapperTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 31);

    private final CrossSectionalCapper capper = new CrossSectionalCapper(0.99, 50, 100.0);

    @Test
    void apply_shouldUseFixedCapForSmallCrossSection() {
        List<FactorObservation> rows = new ArrayList<>();
        for (int i = 1; i < 40; i++) {
            rows.add(row("E" + i, DATE, "pb_ratio", i));
        }
        rows.add(row("OUTLIER", DATE, "pb_ratio", 500.0));

        CrossSectionalCapper.CapResult result = capper.apply("pb_ratio", rows);

        assertEquals(100.0, result.capsByDate.get(DATE), 1e-9);
        assertEquals(1, result.capped.size());
        FactorObservation capped = result.capped.get(0);
        assertEquals("OUTLIER", capped.entityId);
        assertEquals(100.0, capped.factorValue, 1e-9);
        assertTrue(capped.hasFlag(QualityFlag.CAPPED));
        assertEquals(40, result.rows.size());
    }

    @Test
    void apply_shouldUsePercentileForLargeCrossSection() {
        List<FactorObservation> rows = new ArrayList<>();
        for (int i = 1; i <= 200; i++) {
            rows.add(row("E" + i, DATE, "pb_ratio", i));
        }

        CrossSectionalCapper.CapResult result = capper.apply("pb_ratio", rows);

        assertEquals(198.01, result.capsByDate.get(DATE), 1e-9);
        assertEquals(2, result.capped.size());
    }

    @Test
    void apply_shouldLeaveOtherFactorsAndDatesIndependent() {
        LocalDate other = LocalDate.of(2024, 4, 30);
        List<FactorObservation> rows = List.of(
                row("A", DATE, "pb_ratio", 150.0),
                row("A", other, "pb_ratio", 90.0),
                row("A", DATE, "dividend_yield", 150.0)
        );

        CrossSectionalCapper.CapResult result = capper.apply("pb_ratio", rows);

        assertEquals(100.0, result.rows.get(0).factorValue, 1e-9);
        assertEquals(90.0, result.rows.get(1).factorValue, 1e-9);
        assertEquals(150.0, result.rows.get(2).factorValue, 1e-9);
        assertFalse(result.rows.get(2).hasFlag(QualityFlag.CAPPED));
    }

    @Test
    void percentile_shouldInterpolateBetweenRanks() {
        assertEquals(2.5, CrossSectionalCapper.percentile(new double[]{1, 2, 3, 4}, 0.5), 1e-12);
        assertEquals(7.0, CrossSectionalCapper.percentile(new double[]{7}, 0.99), 1e-12);
    }

    private static FactorObservation row(String entity, LocalDate date, String factor, double value) {
        return new FactorObservation(entity, date, factor, value, null, MetricFrequency.MONTHLY, date, Set.of());
    }
}
