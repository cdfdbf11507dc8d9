package com.liquiditysentinel.core.regime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Points added to each regime total when a metric falls in a band, and the
 * factor the normalized totals are scaled by.
 *
 * <p>
 * Loaded from the {@code regimeWeights} section of the engine YAML. The
 * winning regime is scaled to {@code 100 * normalizationFactor}, so with the
 * default factor no regime ever scores above 70.
 * </p>
 *
 * @since 1.0.0
 */
public class RegimeWeights {

    /** Credit growth above the expansion cutoff: points to Expansion. */
    private double creditExpansion = 30;

    /** Credit growth below the contraction cutoff: points to Contraction. */
    private double creditContraction = 30;

    /** Credit growth between the cutoffs: points to Expansion. */
    private double creditNeutralExpansion = 15;

    /** Credit growth between the cutoffs: points to Late-cycle. */
    private double creditNeutralLateCycle = 15;

    /** Tight spreads: points to Expansion. */
    private double spreadTightExpansion = 25;

    /** Wide spreads: points to Contraction. */
    private double spreadWideContraction = 20;

    /** Wide spreads: points to Stress. */
    private double spreadWideStress = 15;

    /** Spreads between the cutoffs: points to Late-cycle. */
    private double spreadNeutralLateCycle = 15;

    /** Volatility below the low percentile: points to Expansion. */
    private double volLowExpansion = 25;

    /** Volatility above the stress percentile: points to Stress. */
    private double volStressStress = 40;

    /** Volatility above the high percentile: points to Contraction. */
    private double volHighContraction = 20;

    /** Volatility above the high percentile: points to Stress. */
    private double volHighStress = 10;

    /** Volatility between the cutoffs: points to Late-cycle. */
    private double volNeutralLateCycle = 10;

    /** Equity drawdown: points to Stress. */
    private double equityDrawdownStress = 30;

    /** Equity drawdown: points to Contraction. */
    private double equityDrawdownContraction = 10;

    /** Valuation running ahead of earnings: points to Late-cycle. */
    private double valuationGapLateCycle = 30;

    /** Valuation running ahead of earnings, subtracted from Expansion. */
    private double valuationGapExpansionPenalty = 10;

    /** Share of 100 given to the highest regime after normalization. */
    private double normalizationFactor = 0.7;

    /** Defaults; used by SnakeYAML before binding. */
    public RegimeWeights() {
    }

    /**
     * Copy constructor. Engine components keep a copy so that later changes
     * to the caller's instance do not affect them.
     *
     * @param other weights to copy; must not be {@code null}
     */
    public RegimeWeights(RegimeWeights other) {
        Objects.requireNonNull(other, "RegimeWeights must not be null");
        this.creditExpansion = other.creditExpansion;
        this.creditContraction = other.creditContraction;
        this.creditNeutralExpansion = other.creditNeutralExpansion;
        this.creditNeutralLateCycle = other.creditNeutralLateCycle;
        this.spreadTightExpansion = other.spreadTightExpansion;
        this.spreadWideContraction = other.spreadWideContraction;
        this.spreadWideStress = other.spreadWideStress;
        this.spreadNeutralLateCycle = other.spreadNeutralLateCycle;
        this.volLowExpansion = other.volLowExpansion;
        this.volStressStress = other.volStressStress;
        this.volHighContraction = other.volHighContraction;
        this.volHighStress = other.volHighStress;
        this.volNeutralLateCycle = other.volNeutralLateCycle;
        this.equityDrawdownStress = other.equityDrawdownStress;
        this.equityDrawdownContraction = other.equityDrawdownContraction;
        this.valuationGapLateCycle = other.valuationGapLateCycle;
        this.valuationGapExpansionPenalty = other.valuationGapExpansionPenalty;
        this.normalizationFactor = other.normalizationFactor;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if a weight is negative or the
     *                               normalization factor is outside (0, 1]
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        requireNonNegative(errors, "creditExpansion", creditExpansion);
        requireNonNegative(errors, "creditContraction", creditContraction);
        requireNonNegative(errors, "creditNeutralExpansion", creditNeutralExpansion);
        requireNonNegative(errors, "creditNeutralLateCycle", creditNeutralLateCycle);
        requireNonNegative(errors, "spreadTightExpansion", spreadTightExpansion);
        requireNonNegative(errors, "spreadWideContraction", spreadWideContraction);
        requireNonNegative(errors, "spreadWideStress", spreadWideStress);
        requireNonNegative(errors, "spreadNeutralLateCycle", spreadNeutralLateCycle);
        requireNonNegative(errors, "volLowExpansion", volLowExpansion);
        requireNonNegative(errors, "volStressStress", volStressStress);
        requireNonNegative(errors, "volHighContraction", volHighContraction);
        requireNonNegative(errors, "volHighStress", volHighStress);
        requireNonNegative(errors, "volNeutralLateCycle", volNeutralLateCycle);
        requireNonNegative(errors, "equityDrawdownStress", equityDrawdownStress);
        requireNonNegative(errors, "equityDrawdownContraction", equityDrawdownContraction);
        requireNonNegative(errors, "valuationGapLateCycle", valuationGapLateCycle);
        requireNonNegative(errors, "valuationGapExpansionPenalty", valuationGapExpansionPenalty);
        if (!(normalizationFactor > 0 && normalizationFactor <= 1)) {
            errors.add("'normalizationFactor' must be in (0, 1], got: " + normalizationFactor);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid RegimeWeights: " + String.join("; ", errors));
        }
    }

    private static void requireNonNegative(List<String> errors, String key, double value) {
        if (!(value >= 0)) {
            errors.add("'" + key + "' must be >= 0, got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getCreditExpansion() {
        return creditExpansion;
    }

    public void setCreditExpansion(double creditExpansion) {
        this.creditExpansion = creditExpansion;
    }

    public double getCreditContraction() {
        return creditContraction;
    }

    public void setCreditContraction(double creditContraction) {
        this.creditContraction = creditContraction;
    }

    public double getCreditNeutralExpansion() {
        return creditNeutralExpansion;
    }

    public void setCreditNeutralExpansion(double creditNeutralExpansion) {
        this.creditNeutralExpansion = creditNeutralExpansion;
    }

    public double getCreditNeutralLateCycle() {
        return creditNeutralLateCycle;
    }

    public void setCreditNeutralLateCycle(double creditNeutralLateCycle) {
        this.creditNeutralLateCycle = creditNeutralLateCycle;
    }

    public double getSpreadTightExpansion() {
        return spreadTightExpansion;
    }

    public void setSpreadTightExpansion(double spreadTightExpansion) {
        this.spreadTightExpansion = spreadTightExpansion;
    }

    public double getSpreadWideContraction() {
        return spreadWideContraction;
    }

    public void setSpreadWideContraction(double spreadWideContraction) {
        this.spreadWideContraction = spreadWideContraction;
    }

    public double getSpreadWideStress() {
        return spreadWideStress;
    }

    public void setSpreadWideStress(double spreadWideStress) {
        this.spreadWideStress = spreadWideStress;
    }

    public double getSpreadNeutralLateCycle() {
        return spreadNeutralLateCycle;
    }

    public void setSpreadNeutralLateCycle(double spreadNeutralLateCycle) {
        this.spreadNeutralLateCycle = spreadNeutralLateCycle;
    }

    public double getVolLowExpansion() {
        return volLowExpansion;
    }

    public void setVolLowExpansion(double volLowExpansion) {
        this.volLowExpansion = volLowExpansion;
    }

    public double getVolStressStress() {
        return volStressStress;
    }

    public void setVolStressStress(double volStressStress) {
        this.volStressStress = volStressStress;
    }

    public double getVolHighContraction() {
        return volHighContraction;
    }

    public void setVolHighContraction(double volHighContraction) {
        this.volHighContraction = volHighContraction;
    }

    public double getVolHighStress() {
        return volHighStress;
    }

    public void setVolHighStress(double volHighStress) {
        this.volHighStress = volHighStress;
    }

    public double getVolNeutralLateCycle() {
        return volNeutralLateCycle;
    }

    public void setVolNeutralLateCycle(double volNeutralLateCycle) {
        this.volNeutralLateCycle = volNeutralLateCycle;
    }

    public double getEquityDrawdownStress() {
        return equityDrawdownStress;
    }

    public void setEquityDrawdownStress(double equityDrawdownStress) {
        this.equityDrawdownStress = equityDrawdownStress;
    }

    public double getEquityDrawdownContraction() {
        return equityDrawdownContraction;
    }

    public void setEquityDrawdownContraction(double equityDrawdownContraction) {
        this.equityDrawdownContraction = equityDrawdownContraction;
    }

    public double getValuationGapLateCycle() {
        return valuationGapLateCycle;
    }

    public void setValuationGapLateCycle(double valuationGapLateCycle) {
        this.valuationGapLateCycle = valuationGapLateCycle;
    }

    public double getValuationGapExpansionPenalty() {
        return valuationGapExpansionPenalty;
    }

    public void setValuationGapExpansionPenalty(double valuationGapExpansionPenalty) {
        this.valuationGapExpansionPenalty = valuationGapExpansionPenalty;
    }

    public double getNormalizationFactor() {
        return normalizationFactor;
    }

    public void setNormalizationFactor(double normalizationFactor) {
        this.normalizationFactor = normalizationFactor;
    }

    @Override
    public String toString() {
        return "RegimeWeights{normalizationFactor=" + normalizationFactor + '}';
    }
}
