package com.factorbot.factor;

import com.factorbot.align.AlignedValue;
import com.factorbot.rolling.PriceWindow;
import com.factorbot.rolling.SentimentWindow;

import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Everything a rule needs to judge and compute one candidate row, resolved for
 * a single entity and as-of date.
 */
public final class AlignedInputs {
    public final String entityId;
    public final LocalDate asOf;
    private final Map<String, AlignedValue> values;
    private final Map<String, Double> derived;
    public final SentimentWindow sentiment;
    public final PriceWindow priceWindow;

    private AlignedInputs(Builder builder) {
        this.entityId = builder.entityId;
        this.asOf = builder.asOf;
        this.values = Collections.unmodifiableMap(new HashMap<>(builder.values));
        this.derived = Collections.unmodifiableMap(new HashMap<>(builder.derived));
        this.sentiment = builder.sentiment;
        this.priceWindow = builder.priceWindow;
    }

    public static Builder builder(String entityId, LocalDate asOf) {
        return new Builder(entityId, asOf);
    }

    public AlignedValue get(String metricName) {
        AlignedValue value = values.get(metricName);
        return value == null ? AlignedValue.unavailable() : value;
    }

    public double derived(String key, double fallback) {
        Double value = derived.get(key);
        return value == null ? fallback : value;
    }

    /**
     * Latest reference date among the available inputs, or the as-of date.
     */
    public LocalDate latestReferenceDate() {
        LocalDate latest = null;
        for (AlignedValue value : values.values()) {
            if (value.available && value.referenceDate != null
                    && (latest == null || value.referenceDate.isAfter(latest))) {
                latest = value.referenceDate;
            }
        }
        return latest == null ? asOf : latest;
    }

    public static final class Builder {
        private final String entityId;
        private final LocalDate asOf;
        private final Map<String, AlignedValue> values = new HashMap<>();
        private final Map<String, Double> derived = new HashMap<>();
        private SentimentWindow sentiment;
        private PriceWindow priceWindow;

        private Builder(String entityId, LocalDate asOf) {
            this.entityId = entityId;
            this.asOf = asOf;
        }

        public Builder value(String metricName, AlignedValue value) {
            values.put(metricName, value == null ? AlignedValue.unavailable() : value);
            return this;
        }

        public Builder derived(String key, double value) {
            derived.put(key, value);
            return this;
        }

        public Builder sentiment(SentimentWindow window) {
            this.sentiment = window;
            return this;
        }

        public Builder priceWindow(PriceWindow window) {
            this.priceWindow = window;
            return this;
        }

        public AlignedInputs build() {
            return new AlignedInputs(this);
        }
    }
}
