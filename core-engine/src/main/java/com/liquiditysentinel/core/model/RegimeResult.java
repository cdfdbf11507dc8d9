package com.liquiditysentinel.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one regime classification.
 *
 * @since 1.0.0
 */
public final class RegimeResult {

    private final Regime primaryRegime;
    private final RegimeScore scores;
    private final List<String> explanations;
    private final double confidence;
    private final String dataQualityWarning;
    private final MetricSnapshot metrics;

    public RegimeResult(Regime primaryRegime,
                        RegimeScore scores,
                        List<String> explanations,
                        double confidence,
                        String dataQualityWarning,
                        MetricSnapshot metrics) {
        this.primaryRegime = Objects.requireNonNull(primaryRegime, "primaryRegime must not be null");
        this.scores = Objects.requireNonNull(scores, "scores must not be null");
        this.explanations = List.copyOf(Objects.requireNonNull(explanations, "explanations must not be null"));
        this.confidence = confidence;
        this.dataQualityWarning = dataQualityWarning;
        this.metrics = metrics != null ? metrics : MetricSnapshot.empty();
        if (this.explanations.size() > 3) {
            throw new IllegalArgumentException("At most 3 explanations allowed, got: " + this.explanations.size());
        }
    }

    public Regime getPrimaryRegime() {
        return primaryRegime;
    }

    public RegimeScore getScores() {
        return scores;
    }

    public List<String> getExplanations() {
        return explanations;
    }

    /**
     * @return gap between the top two scores divided by 100
     */
    public double getConfidence() {
        return confidence;
    }

    public Optional<String> getDataQualityWarning() {
        return Optional.ofNullable(dataQualityWarning);
    }

    /**
     * @return the scalar inputs the classification was computed from
     */
    public MetricSnapshot getMetrics() {
        return metrics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegimeResult that))
            return false;
        return primaryRegime == that.primaryRegime
                && Double.compare(confidence, that.confidence) == 0
                && scores.equals(that.scores)
                && explanations.equals(that.explanations)
                && Objects.equals(dataQualityWarning, that.dataQualityWarning)
                && metrics.equals(that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primaryRegime, scores, explanations, confidence, dataQualityWarning, metrics);
    }

    @Override
    public String toString() {
        return "RegimeResult{" +
                "primaryRegime=" + primaryRegime +
                ", scores=" + scores +
                ", confidence=" + confidence +
                ", warning='" + dataQualityWarning + '\'' +
                '}';
    }
}
