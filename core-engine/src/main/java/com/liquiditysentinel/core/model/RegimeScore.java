package com.liquiditysentinel.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized score per {@link Regime}, each within [0, 100].
 *
 * <p>
 * Scores are independent heuristics and do not sum to a constant.
 * </p>
 *
 * @since 1.0.0
 */
public final class RegimeScore {

    private final EnumMap<Regime, Double> scores = new EnumMap<>(Regime.class);

    /**
     * Values are clamped to [0, 100].
     */
    public RegimeScore(double expansion, double lateCycle, double contraction, double stress) {
        scores.put(Regime.EXPANSION, clamp(expansion));
        scores.put(Regime.LATE_CYCLE, clamp(lateCycle));
        scores.put(Regime.CONTRACTION, clamp(contraction));
        scores.put(Regime.STRESS, clamp(stress));
    }

    public double getExpansion() {
        return scores.get(Regime.EXPANSION);
    }

    public double getLateCycle() {
        return scores.get(Regime.LATE_CYCLE);
    }

    public double getContraction() {
        return scores.get(Regime.CONTRACTION);
    }

    public double getStress() {
        return scores.get(Regime.STRESS);
    }

    public double get(Regime regime) {
        return scores.get(Objects.requireNonNull(regime, "regime must not be null"));
    }

    /**
     * Regime with the highest score. Ties go to the regime declared first in
     * {@link Regime}.
     *
     * @return the primary regime
     */
    public Regime primary() {
        Regime best = Regime.EXPANSION;
        for (Regime regime : Regime.values()) {
            if (scores.get(regime) > scores.get(best)) {
                best = regime;
            }
        }
        return best;
    }

    /**
     * @return unmodifiable label-to-score map in declaration order
     */
    public Map<String, Double> toMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        scores.forEach((regime, score) -> out.put(regime.getLabel(), score));
        return Collections.unmodifiableMap(out);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.min(100.0, Math.max(0.0, v));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegimeScore that))
            return false;
        return scores.equals(that.scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return "RegimeScore" + toMap();
    }
}
