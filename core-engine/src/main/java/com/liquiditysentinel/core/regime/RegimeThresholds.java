package com.liquiditysentinel.core.regime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cutoffs applied by {@link RegimeClassifier} to each extracted metric.
 *
 * <p>
 * Loaded from the {@code regimeThresholds} section of the engine YAML; keys
 * left out keep the defaults below. {@link RegimeClassifier} validates and
 * copies the instance it is given.
 * </p>
 *
 * @since 1.0.0
 */
public class RegimeThresholds {

    /** 3M annualized credit growth (%) above which credit signals expansion. */
    private double creditGrowthExpansion = 3.0;

    /** 3M annualized credit growth (%) below which credit signals contraction. */
    private double creditGrowthContraction = 0.0;

    /** Spread z-score below which spreads count as tight. */
    private double spreadZscoreTight = -0.5;

    /** Spread z-score above which spreads count as wide. */
    private double spreadZscoreWide = 1.0;

    // --- Volatility percentiles ---
    private double vixPercentileLow = 30;
    private double vixPercentileHigh = 70;
    private double vixStress = 90;

    /** Valuation minus earnings z-score gap above which the cycle is late. */
    private double valuationVsEarningsGap = 0.5;

    /** 1M equity return (%) below which a drawdown amplifies stress. */
    private double equityDrawdown = -5.0;

    /** Defaults; used by SnakeYAML before binding. */
    public RegimeThresholds() {
    }

    /**
     * Copy constructor. Engine components keep a copy so that later changes
     * to the caller's instance do not affect them.
     *
     * @param other cutoffs to copy; must not be {@code null}
     */
    public RegimeThresholds(RegimeThresholds other) {
        Objects.requireNonNull(other, "RegimeThresholds must not be null");
        this.creditGrowthExpansion = other.creditGrowthExpansion;
        this.creditGrowthContraction = other.creditGrowthContraction;
        this.spreadZscoreTight = other.spreadZscoreTight;
        this.spreadZscoreWide = other.spreadZscoreWide;
        this.vixPercentileLow = other.vixPercentileLow;
        this.vixPercentileHigh = other.vixPercentileHigh;
        this.vixStress = other.vixStress;
        this.valuationVsEarningsGap = other.valuationVsEarningsGap;
        this.equityDrawdown = other.equityDrawdown;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if the cutoffs are inconsistent
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(creditGrowthContraction <= creditGrowthExpansion)) {
            errors.add("'creditGrowthContraction' must be <= 'creditGrowthExpansion'");
        }
        if (!(spreadZscoreTight < spreadZscoreWide)) {
            errors.add("'spreadZscoreTight' must be < 'spreadZscoreWide'");
        }
        if (!(0 <= vixPercentileLow && vixPercentileLow <= vixPercentileHigh
                && vixPercentileHigh <= vixStress && vixStress <= 100)) {
            errors.add("VIX percentiles must satisfy 0 <= low <= high <= stress <= 100");
        }
        if (Double.isNaN(valuationVsEarningsGap)) {
            errors.add("'valuationVsEarningsGap' must be a number");
        }
        if (Double.isNaN(equityDrawdown)) {
            errors.add("'equityDrawdown' must be a number");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid RegimeThresholds: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getCreditGrowthExpansion() {
        return creditGrowthExpansion;
    }

    public void setCreditGrowthExpansion(double creditGrowthExpansion) {
        this.creditGrowthExpansion = creditGrowthExpansion;
    }

    public double getCreditGrowthContraction() {
        return creditGrowthContraction;
    }

    public void setCreditGrowthContraction(double creditGrowthContraction) {
        this.creditGrowthContraction = creditGrowthContraction;
    }

    public double getSpreadZscoreTight() {
        return spreadZscoreTight;
    }

    public void setSpreadZscoreTight(double spreadZscoreTight) {
        this.spreadZscoreTight = spreadZscoreTight;
    }

    public double getSpreadZscoreWide() {
        return spreadZscoreWide;
    }

    public void setSpreadZscoreWide(double spreadZscoreWide) {
        this.spreadZscoreWide = spreadZscoreWide;
    }

    public double getVixPercentileLow() {
        return vixPercentileLow;
    }

    public void setVixPercentileLow(double vixPercentileLow) {
        this.vixPercentileLow = vixPercentileLow;
    }

    public double getVixPercentileHigh() {
        return vixPercentileHigh;
    }

    public void setVixPercentileHigh(double vixPercentileHigh) {
        this.vixPercentileHigh = vixPercentileHigh;
    }

    public double getVixStress() {
        return vixStress;
    }

    public void setVixStress(double vixStress) {
        this.vixStress = vixStress;
    }

    public double getValuationVsEarningsGap() {
        return valuationVsEarningsGap;
    }

    public void setValuationVsEarningsGap(double valuationVsEarningsGap) {
        this.valuationVsEarningsGap = valuationVsEarningsGap;
    }

    public double getEquityDrawdown() {
        return equityDrawdown;
    }

    public void setEquityDrawdown(double equityDrawdown) {
        this.equityDrawdown = equityDrawdown;
    }

    @Override
    public String toString() {
        return "RegimeThresholds{" +
                "creditGrowthExpansion=" + creditGrowthExpansion +
                ", creditGrowthContraction=" + creditGrowthContraction +
                ", spreadZscoreTight=" + spreadZscoreTight +
                ", spreadZscoreWide=" + spreadZscoreWide +
                ", vixPercentileLow=" + vixPercentileLow +
                ", vixPercentileHigh=" + vixPercentileHigh +
                ", vixStress=" + vixStress +
                ", valuationVsEarningsGap=" + valuationVsEarningsGap +
                ", equityDrawdown=" + equityDrawdown +
                '}';
    }
}
