package com.factorbot.normalize;

import com.factorbot.model.AtomicObservation;
import com.factorbot.model.MetricFrequency;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps provider-shaped records onto {@link AtomicObservation}.
 *
 * <p>Records without an entity id, an observation date or a metric name are
 * dropped and counted. A value that cannot be parsed becomes {@code null}
 * and the record is kept.</p>
 */
public final class AtomicNormalizer {
    private static final Logger LOG = LogManager.getLogger(AtomicNormalizer.class);

    private static final String[] ENTITY_KEYS = {"entity_id", "symbol", "ticker"};
    private static final String[] DATE_KEYS = {"observation_date", "date", "as_of"};
    private static final String[] METRIC_KEYS = {"metric_name", "factor_name", "metric"};
    private static final String[] VALUE_KEYS = {"value", "factor_value", "metric_value"};
    private static final String[] FREQUENCY_KEYS = {"metric_frequency", "frequency", "period_type"};
    private static final String[] REFERENCE_KEYS = {"report_reference_date", "source_report_date", "report_date"};
    private static final Set<String> MISSING_TOKENS = Set.of("", "nan", "nat", "none", "null");

    public NormalizeResult normalize(Iterable<JSONObject> records) {
        List<AtomicObservation> out = new ArrayList<>();
        Map<String, Integer> dropped = new TreeMap<>();
        Set<String> seenKeys = new HashSet<>();
        int input = 0;
        int nullValues = 0;
        int duplicates = 0;
        if (records == null) {
            return new NormalizeResult(out, 0, dropped, 0, 0);
        }
        for (JSONObject record : records) {
            input++;
            if (record == null) {
                dropped.merge(NormalizeResult.NULL_RECORD, 1, Integer::sum);
                continue;
            }
            String entityId = normalizeEntity(firstText(record, ENTITY_KEYS));
            if (entityId.isEmpty()) {
                dropped.merge(NormalizeResult.MISSING_ENTITY_ID, 1, Integer::sum);
                continue;
            }
            LocalDate observationDate = parseDate(firstValue(record, DATE_KEYS));
            if (observationDate == null) {
                dropped.merge(NormalizeResult.MISSING_OBSERVATION_DATE, 1, Integer::sum);
                continue;
            }
            String metricName = firstText(record, METRIC_KEYS);
            if (metricName.isEmpty()) {
                dropped.merge(NormalizeResult.MISSING_METRIC_NAME, 1, Integer::sum);
                continue;
            }

            Double value = parseNumber(firstValue(record, VALUE_KEYS));
            if (value == null) {
                nullValues++;
            }
            String source = firstText(record, new String[]{"source"});
            MetricFrequency frequency = MetricFrequency.fromLabel(firstText(record, FREQUENCY_KEYS));
            LocalDate referenceDate = parseDate(firstValue(record, REFERENCE_KEYS));

            AtomicObservation observation = new AtomicObservation(
                    entityId,
                    observationDate,
                    metricName,
                    value,
                    source.isEmpty() ? "unknown" : source,
                    frequency,
                    referenceDate
            );
            if (!seenKeys.add(entityId + "|" + metricName + "|" + observationDate)) {
                duplicates++;
            }
            out.add(observation);
        }
        NormalizeResult result = new NormalizeResult(out, input, dropped, nullValues, duplicates);
        LOG.info("stage=normalize in={} out={} dropped={} null_values={} duplicate_keys={}",
                input, out.size(), result.droppedCount(), nullValues, duplicates);
        return result;
    }

    static String normalizeEntity(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    static LocalDate parseDate(Object raw) {
        if (raw == null || raw == JSONObject.NULL) {
            return null;
        }
        if (raw instanceof LocalDate) {
            return (LocalDate) raw;
        }
        if (raw instanceof LocalDateTime) {
            return ((LocalDateTime) raw).toLocalDate();
        }
        String text = raw.toString().trim();
        if (MISSING_TOKENS.contains(text.toLowerCase(Locale.ROOT)) || text.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(text.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Double parseNumber(Object raw) {
        if (raw == null || raw == JSONObject.NULL || raw instanceof Boolean) {
            return null;
        }
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        String text = raw.toString().trim();
        if (MISSING_TOKENS.contains(text.toLowerCase(Locale.ROOT))) {
            return null;
        }
        try {
            double value = Double.parseDouble(text.replace(",", ""));
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Object firstValue(JSONObject record, String[] keys) {
        for (String key : keys) {
            if (record.has(key) && !record.isNull(key)) {
                return record.get(key);
            }
        }
        return null;
    }

    private static String firstText(JSONObject record, String[] keys) {
        Object value = firstValue(record, keys);
        if (value == null) {
            return "";
        }
        String text = value.toString().trim();
        return MISSING_TOKENS.contains(text.toLowerCase(Locale.ROOT)) ? "" : text;
    }
}
