package com.factorbot.quality;

import com.factorbot.model.FactorObservation;
import com.factorbot.model.MetricFrequency;
import com.factorbot.model.QualityFlag;
import com.factorbot.model.QualityVerdict;
import com.factorbot.normalize.NormalizeResult;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QualityReportTest {

    private static final LocalDate DATE = LocalDate.of(2024, 4, 30);

    @Test
    void mergedTalliesShouldAddUpCountsAndFlags() {
        QualityTally first = new QualityTally();
        first.recordKept(row("AAA", EnumSet.of(QualityFlag.FINANCIAL_STALE)));
        first.recordDropped("AAA", DATE, "debt_to_equity",
                QualityVerdict.drop("data_expired", EnumSet.of(QualityFlag.DATA_EXPIRED)));
        QualityTally second = new QualityTally();
        second.recordKept(row("BBB", Set.of()));
        second.recordDropped("BBB", DATE, "debt_to_equity", QualityVerdict.drop("debt_missing"));

        QualityTally total = new QualityTally();
        total.merge(first);
        total.merge(second);

        assertEquals(4, total.evaluated());
        assertEquals(2, total.kept());
        assertEquals(2, total.dropped());
        assertEquals(1, total.staleCount());
        assertEquals(1, total.expiredCount());
        assertEquals(2, total.keptPerFactor().get("debt_to_equity"));
        assertEquals(2, total.flagEvents().size());
    }

    @Test
    void summaryShouldContainRequiredFields() {
        QualityTally tally = new QualityTally();
        tally.recordKept(row("AAA", Set.of()));
        NormalizeResult normalized = new NormalizeResult(List.of(), 3, Map.of("missing_entity_id", 3), 0, 0);

        String summary = QualityReport.of(normalized, tally, Map.of("BAD", "IllegalStateException: boom")).summary();

        assertTrue(summary.contains("normalized=0"));
        assertTrue(summary.contains("malformed=3"));
        assertTrue(summary.contains("kept=1"));
        assertTrue(summary.contains("entity_failures=1"));
    }

    @Test
    void toJsonShouldExposeDropReasonsAndFlagList() {
        QualityTally tally = new QualityTally();
        tally.recordDropped("AAA", DATE, "debt_to_equity",
                QualityVerdict.drop("data_expired", EnumSet.of(QualityFlag.DATA_EXPIRED)));

        QualityReport report = QualityReport.of(null, tally, null);
        JSONObject json = report.toJson();

        assertEquals(1, report.droppedFor("data_expired"));
        assertEquals(1, report.flagged("data_expired"));
        assertEquals(1, json.getJSONObject("quality").getJSONObject("drop_reasons").getInt("data_expired"));
        JSONObject flag = json.getJSONArray("flags").getJSONObject(0);
        assertEquals("AAA", flag.getString("entity_id"));
        assertEquals("2024-04-30", flag.getString("observation_date"));
        assertEquals("data_expired", flag.getString("flag"));
        assertEquals(false, flag.getBoolean("kept"));
        assertEquals(0, json.getJSONObject("normalize").getInt("input_records"));
    }

    private static FactorObservation row(String entity, Set<QualityFlag> flags) {
        return new FactorObservation(entity, DATE, "debt_to_equity", 1.2, null, MetricFrequency.QUARTERLY, DATE, flags);
    }
}
