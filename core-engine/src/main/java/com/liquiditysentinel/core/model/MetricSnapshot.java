package com.liquiditysentinel.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named scalar metrics observed "as of" a date.
 *
 * <p>
 * Every metric is optional. {@code NaN} and {@code null} values passed to the
 * builder are recorded as absent, so consumers only ever see finite or
 * infinite numbers through {@link #getValue(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSnapshot {

    private final LocalDate asOf;
    private final Map<String, Double> values;

    private MetricSnapshot(Builder builder) {
        this.asOf = builder.asOf;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(builder.values));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return an empty snapshot with no date
     */
    public static MetricSnapshot empty() {
        return new Builder().build();
    }

    /**
     * Fluent builder for {@link MetricSnapshot}.
     */
    public static class Builder {
        private LocalDate asOf;
        private final Map<String, Double> values = new LinkedHashMap<>();

        public Builder asOf(LocalDate asOf) {
            this.asOf = asOf;
            return this;
        }

        /**
         * Record a metric. {@code null} and {@code NaN} mark it as absent.
         *
         * @param name  metric name; must not be {@code null}
         * @param value metric value
         * @return this builder
         */
        public Builder put(String name, Double value) {
            Objects.requireNonNull(name, "Metric name must not be null");
            if (value == null || value.isNaN()) {
                values.remove(name);
            } else {
                values.put(name, value);
            }
            return this;
        }

        public MetricSnapshot build() {
            return new MetricSnapshot(this);
        }
    }

    /**
     * @return the reference date, or {@code null} when the snapshot is taken at
     *         the latest available observation of each input
     */
    public LocalDate getAsOf() {
        return asOf;
    }

    /**
     * @param name metric name
     * @return optional containing the value when available
     */
    public Optional<Double> getValue(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * @return unmodifiable view of all available metrics in insertion order
     */
    public Map<String, Double> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSnapshot that))
            return false;
        return Objects.equals(asOf, that.asOf) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(asOf, values);
    }

    @Override
    public String toString() {
        return "MetricSnapshot{asOf=" + asOf + ", values=" + values + '}';
    }
}
