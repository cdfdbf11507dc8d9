package com.liquiditysentinel.core.derived;

import com.liquiditysentinel.core.model.TimeSeries;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of one balance-sheet diagnostic: a label and a 0-100 score per
 * observation, plus named auxiliary series and boolean flags on the same index.
 *
 * <p>
 * An empty bundle (no observations) is returned when inputs are missing,
 * too short or misaligned.
 * </p>
 *
 * @since 1.0.0
 */
public final class DiagnosticBundle {

    private final String name;
    private final List<LocalDate> index;
    private final List<String> labels;
    private final TimeSeries score;
    private final Map<String, TimeSeries> aux;
    private final Map<String, List<Boolean>> flags;

    private DiagnosticBundle(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Bundle name must not be null");
        this.score = builder.score != null ? builder.score : TimeSeries.empty(name + "_score");
        this.index = score.dates();
        this.labels = Collections.unmodifiableList(new ArrayList<>(builder.labels));
        if (labels.size() != index.size()) {
            throw new IllegalArgumentException("Bundle '" + name + "' has " + labels.size()
                    + " labels for " + index.size() + " observations");
        }
        builder.aux.forEach((key, series) -> {
            if (!series.isAlignedWith(score)) {
                throw new IllegalArgumentException("Aux series '" + key + "' of '" + name
                        + "' is not aligned with the score index");
            }
        });
        builder.flags.forEach((key, values) -> {
            if (values.size() != index.size()) {
                throw new IllegalArgumentException("Flag '" + key + "' of '" + name
                        + "' has " + values.size() + " entries for " + index.size() + " observations");
            }
        });
        this.aux = Collections.unmodifiableMap(new LinkedHashMap<>(builder.aux));
        Map<String, List<Boolean>> flagCopy = new LinkedHashMap<>();
        builder.flags.forEach((key, values) -> flagCopy.put(key, List.copyOf(values)));
        this.flags = Collections.unmodifiableMap(flagCopy);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * @param name diagnostic name
     * @return a bundle with no observations
     */
    public static DiagnosticBundle empty(String name) {
        return builder(name).build();
    }

    /**
     * Fluent builder for {@link DiagnosticBundle}.
     */
    public static class Builder {
        private final String name;
        private TimeSeries score;
        private List<String> labels = List.of();
        private final Map<String, TimeSeries> aux = new LinkedHashMap<>();
        private final Map<String, List<Boolean>> flags = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder score(TimeSeries score) {
            this.score = score;
            return this;
        }

        public Builder labels(List<String> labels) {
            this.labels = Objects.requireNonNull(labels, "labels must not be null");
            return this;
        }

        public Builder aux(String key, TimeSeries series) {
            aux.put(key, Objects.requireNonNull(series, "aux series must not be null"));
            return this;
        }

        public Builder flag(String key, List<Boolean> values) {
            flags.put(key, Objects.requireNonNull(values, "flag values must not be null"));
            return this;
        }

        public DiagnosticBundle build() {
            return new DiagnosticBundle(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public List<LocalDate> getIndex() {
        return index;
    }

    /** Band label per observation; {@code null} where the input is missing. */
    public List<String> getLabels() {
        return labels;
    }

    public TimeSeries getScore() {
        return score;
    }

    public Map<String, TimeSeries> getAux() {
        return aux;
    }

    public Optional<TimeSeries> getAux(String key) {
        return Optional.ofNullable(aux.get(key));
    }

    public Map<String, List<Boolean>> getFlags() {
        return flags;
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    /**
     * @return label of the last observation, empty when there is none or it is
     *         missing
     */
    public Optional<String> latestLabel() {
        return labels.isEmpty() ? Optional.empty() : Optional.ofNullable(labels.get(labels.size() - 1));
    }

    /**
     * @return score of the last observation, {@code NaN} when there is none
     */
    public double latestScore() {
        return score.latestValue();
    }

    @Override
    public String toString() {
        return "DiagnosticBundle{name='" + name + "', size=" + index.size()
                + ", latest=" + latestLabel().orElse(null) + '}';
    }
}
