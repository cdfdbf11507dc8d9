package com.liquiditysentinel.core.derived;

import java.util.Objects;

/**
 * One band of a {@link PiecewiseScorer}: values from {@code lowerBound} up to
 * the next band's lower bound get {@code label} and a score rescaled into
 * {@code [scoreFloor, scoreCeiling]}.
 *
 * @since 1.0.0
 */
public final class ScoreBand {

    private final double lowerBound;
    private final String label;
    private final double scoreFloor;
    private final double scoreCeiling;

    public ScoreBand(double lowerBound, String label, double scoreFloor, double scoreCeiling) {
        this.label = Objects.requireNonNull(label, "Band label must not be null");
        if (Double.isNaN(lowerBound)) {
            throw new IllegalArgumentException("Band '" + label + "' lower bound must not be NaN");
        }
        if (!(scoreFloor <= scoreCeiling)) {
            throw new IllegalArgumentException("Band '" + label + "' score floor " + scoreFloor
                    + " exceeds ceiling " + scoreCeiling);
        }
        this.lowerBound = lowerBound;
        this.scoreFloor = scoreFloor;
        this.scoreCeiling = scoreCeiling;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public String getLabel() {
        return label;
    }

    public double getScoreFloor() {
        return scoreFloor;
    }

    public double getScoreCeiling() {
        return scoreCeiling;
    }

    @Override
    public String toString() {
        return label + "[" + lowerBound + ", score " + scoreFloor + ".." + scoreCeiling + "]";
    }
}
