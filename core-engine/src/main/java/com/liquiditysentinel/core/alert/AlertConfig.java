package com.liquiditysentinel.core.alert;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Thresholds for the built-in alert rules.
 *
 * <p>
 * Loaded from the {@code alerts} section of the engine YAML:
 * </p>
 *
 * <pre>
 * alerts:
 *   beliefZscoreGapYellow: 0.3
 *   beliefZscoreGapRed: 0.6
 *   vixPercentileRed: 90
 * </pre>
 *
 * <p>
 * Omitted keys keep their defaults. Each rule validates the instance it is
 * given and keeps its own copy, so changes made afterwards have no effect on
 * it.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertConfig {

    // --- Belief overheating ---
    /** Valuation minus earnings z-score change that raises a Yellow alert. */
    private double beliefZscoreGapYellow = 0.3;

    /** Valuation minus earnings z-score change that raises a Red alert. */
    private double beliefZscoreGapRed = 0.6;

    // --- Collateral stress ---
    private double vixPercentileYellow = 75;
    private double vixPercentileRed = 90;
    private double spreadPercentileYellow = 70;
    private double spreadPercentileRed = 85;

    /** 1M equity return (%) at or below which the equity signal is Yellow. */
    private double equityDrawdownYellow = -3.0;

    /** 1M equity return (%) at or below which the equity signal is Red. */
    private double equityDrawdownRed = -7.0;

    // --- Balance-sheet contraction ---
    /** 3M annualized credit growth (%) below which credit is contracting. */
    private double credit3mThreshold = 0.0;

    /** 3M annualized credit growth (%) below which credit is decelerating. */
    private double creditDecelerationThreshold = -2.0;

    /** Defaults; used by SnakeYAML before binding. */
    public AlertConfig() {
    }

    /**
     * Copy constructor. Engine components keep a copy so that later changes
     * to the caller's instance do not affect them.
     *
     * @param other thresholds to copy; must not be {@code null}
     */
    public AlertConfig(AlertConfig other) {
        Objects.requireNonNull(other, "AlertConfig must not be null");
        this.beliefZscoreGapYellow = other.beliefZscoreGapYellow;
        this.beliefZscoreGapRed = other.beliefZscoreGapRed;
        this.vixPercentileYellow = other.vixPercentileYellow;
        this.vixPercentileRed = other.vixPercentileRed;
        this.spreadPercentileYellow = other.spreadPercentileYellow;
        this.spreadPercentileRed = other.spreadPercentileRed;
        this.equityDrawdownYellow = other.equityDrawdownYellow;
        this.equityDrawdownRed = other.equityDrawdownRed;
        this.credit3mThreshold = other.credit3mThreshold;
        this.creditDecelerationThreshold = other.creditDecelerationThreshold;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check that every Red threshold is at least as severe as its Yellow
     * counterpart.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(beliefZscoreGapYellow <= beliefZscoreGapRed)) {
            errors.add("'beliefZscoreGapYellow' must be <= 'beliefZscoreGapRed'");
        }
        if (!(vixPercentileYellow <= vixPercentileRed)) {
            errors.add("'vixPercentileYellow' must be <= 'vixPercentileRed'");
        }
        if (!(spreadPercentileYellow <= spreadPercentileRed)) {
            errors.add("'spreadPercentileYellow' must be <= 'spreadPercentileRed'");
        }
        if (!(equityDrawdownRed <= equityDrawdownYellow)) {
            errors.add("'equityDrawdownRed' must be <= 'equityDrawdownYellow'");
        }
        if (Double.isNaN(credit3mThreshold) || Double.isNaN(creditDecelerationThreshold)) {
            errors.add("Credit thresholds must be numbers");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid AlertConfig: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getBeliefZscoreGapYellow() {
        return beliefZscoreGapYellow;
    }

    public void setBeliefZscoreGapYellow(double beliefZscoreGapYellow) {
        this.beliefZscoreGapYellow = beliefZscoreGapYellow;
    }

    public double getBeliefZscoreGapRed() {
        return beliefZscoreGapRed;
    }

    public void setBeliefZscoreGapRed(double beliefZscoreGapRed) {
        this.beliefZscoreGapRed = beliefZscoreGapRed;
    }

    public double getVixPercentileYellow() {
        return vixPercentileYellow;
    }

    public void setVixPercentileYellow(double vixPercentileYellow) {
        this.vixPercentileYellow = vixPercentileYellow;
    }

    public double getVixPercentileRed() {
        return vixPercentileRed;
    }

    public void setVixPercentileRed(double vixPercentileRed) {
        this.vixPercentileRed = vixPercentileRed;
    }

    public double getSpreadPercentileYellow() {
        return spreadPercentileYellow;
    }

    public void setSpreadPercentileYellow(double spreadPercentileYellow) {
        this.spreadPercentileYellow = spreadPercentileYellow;
    }

    public double getSpreadPercentileRed() {
        return spreadPercentileRed;
    }

    public void setSpreadPercentileRed(double spreadPercentileRed) {
        this.spreadPercentileRed = spreadPercentileRed;
    }

    public double getEquityDrawdownYellow() {
        return equityDrawdownYellow;
    }

    public void setEquityDrawdownYellow(double equityDrawdownYellow) {
        this.equityDrawdownYellow = equityDrawdownYellow;
    }

    public double getEquityDrawdownRed() {
        return equityDrawdownRed;
    }

    public void setEquityDrawdownRed(double equityDrawdownRed) {
        this.equityDrawdownRed = equityDrawdownRed;
    }

    public double getCredit3mThreshold() {
        return credit3mThreshold;
    }

    public void setCredit3mThreshold(double credit3mThreshold) {
        this.credit3mThreshold = credit3mThreshold;
    }

    public double getCreditDecelerationThreshold() {
        return creditDecelerationThreshold;
    }

    public void setCreditDecelerationThreshold(double creditDecelerationThreshold) {
        this.creditDecelerationThreshold = creditDecelerationThreshold;
    }

    @Override
    public String toString() {
        return "AlertConfig{" +
                "beliefZscoreGapYellow=" + beliefZscoreGapYellow +
                ", beliefZscoreGapRed=" + beliefZscoreGapRed +
                ", vixPercentileYellow=" + vixPercentileYellow +
                ", vixPercentileRed=" + vixPercentileRed +
                ", spreadPercentileYellow=" + spreadPercentileYellow +
                ", spreadPercentileRed=" + spreadPercentileRed +
                ", equityDrawdownYellow=" + equityDrawdownYellow +
                ", equityDrawdownRed=" + equityDrawdownRed +
                ", credit3mThreshold=" + credit3mThreshold +
                ", creditDecelerationThreshold=" + creditDecelerationThreshold +
                '}';
    }
}
