package com.factorbot.normalize;

import com.factorbot.model.AtomicObservation;
import com.factorbot.model.MetricFrequency;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AtomicNormalizerTest {

    private final AtomicNormalizer normalizer = new AtomicNormalizer();

    @Test
    void normalize_shouldMapProviderAliasesOntoCanonicalFields() {
        JSONObject record = new JSONObject()
                .put("symbol", " aapl ")
                .put("date", "2024-03-31T00:00:00")
                .put("metric", "book_value")
                .put("metric_value", "1,234.5")
                .put("period_type", "Quarterly")
                .put("report_date", "2024-03-31");

        NormalizeResult result = normalizer.normalize(List.of(record));

        assertEquals(1, result.observations.size());
        AtomicObservation observation = result.observations.get(0);
        assertEquals("AAPL", observation.entityId);
        assertEquals(LocalDate.of(2024, 3, 31), observation.observationDate);
        assertEquals("book_value", observation.metricName);
        assertEquals(1234.5, observation.value, 1e-9);
        assertEquals(MetricFrequency.QUARTERLY, observation.frequency);
        assertEquals("unknown", observation.source);
        assertEquals(LocalDate.of(2024, 3, 31), observation.reportReferenceDate);
    }

    @Test
    void normalize_shouldDropRecordsMissingIdentityFieldsAndCountReasons() {
        JSONObject noEntity = new JSONObject().put("date", "2024-01-02").put("metric_name", "x").put("value", 1);
        JSONObject badDate = new JSONObject().put("entity_id", "MSFT").put("date", "nan").put("metric_name", "x").put("value", 1);
        JSONObject unparseable = new JSONObject().put("entity_id", "MSFT").put("date", "2024-13-45").put("metric_name", "x");
        JSONObject noMetric = new JSONObject().put("entity_id", "MSFT").put("date", "2024-01-02").put("value", 1);
        JSONObject ok = new JSONObject().put("entity_id", "MSFT").put("date", "2024-01-02").put("metric_name", "x").put("value", 1);

        NormalizeResult result = normalizer.normalize(Arrays.asList(noEntity, badDate, unparseable, noMetric, null, ok));

        assertEquals(6, result.inputCount);
        assertEquals(1, result.observations.size());
        assertEquals(5, result.droppedCount());
        assertEquals(1, result.droppedByReason.get(NormalizeResult.MISSING_ENTITY_ID));
        assertEquals(2, result.droppedByReason.get(NormalizeResult.MISSING_OBSERVATION_DATE));
        assertEquals(1, result.droppedByReason.get(NormalizeResult.MISSING_METRIC_NAME));
        assertEquals(1, result.droppedByReason.get(NormalizeResult.NULL_RECORD));
    }

    @Test
    void normalize_shouldKeepUnparseableValuesAsNull() {
        JSONObject nanText = new JSONObject().put("ticker", "IBM").put("observation_date", "2024-02-01")
                .put("factor_name", "news_sentiment_daily").put("value", "NaN");
        JSONObject garbage = new JSONObject().put("ticker", "IBM").put("observation_date", "2024-02-02")
                .put("factor_name", "news_sentiment_daily").put("value", "n/a");

        NormalizeResult result = normalizer.normalize(List.of(nanText, garbage));

        assertEquals(2, result.observations.size());
        assertEquals(2, result.nullValueCount);
        assertNull(result.observations.get(0).value);
        assertTrue(result.droppedByReason.isEmpty());
    }

    @Test
    void normalize_shouldCountDuplicateKeysButKeepEveryRecord() {
        JSONObject first = new JSONObject().put("entity_id", "IBM").put("date", "2024-02-01")
                .put("metric_name", "adjusted_close_price").put("value", 10.0);
        JSONObject second = new JSONObject().put("entity_id", "ibm").put("date", "2024-02-01")
                .put("metric_name", "adjusted_close_price").put("value", 11.0);

        NormalizeResult result = normalizer.normalize(List.of(first, second));

        assertEquals(2, result.observations.size());
        assertEquals(1, result.duplicateKeyCount);
    }

    @Test
    void parseNumber_shouldRejectNonNumericInputs() {
        assertNull(AtomicNormalizer.parseNumber(Boolean.TRUE));
        assertNull(AtomicNormalizer.parseNumber("inf"));
        assertNull(AtomicNormalizer.parseNumber(JSONObject.NULL));
        assertEquals(-2500.0, AtomicNormalizer.parseNumber("-2,500"), 1e-9);
        assertEquals(3.0, AtomicNormalizer.parseNumber(3), 1e-9);
    }

    @Test
    void parseDate_shouldAcceptDateTimesAndRejectShortText() {
        assertEquals(LocalDate.of(2023, 12, 29), AtomicNormalizer.parseDate("2023-12-29 16:00:00"));
        assertNull(AtomicNormalizer.parseDate("2024-1-5"));
        assertNull(AtomicNormalizer.parseDate("NaT"));
    }

    @Test
    void parseDate_shouldAcceptTemporalObjects() {
        assertEquals(LocalDate.of(2024, 2, 29), AtomicNormalizer.parseDate(LocalDate.of(2024, 2, 29)));
        assertEquals(LocalDate.of(2024, 2, 29), AtomicNormalizer.parseDate(LocalDateTime.of(2024, 2, 29, 23, 59)));
        assertNull(AtomicNormalizer.parseNumber(Double.NaN));
    }
}
