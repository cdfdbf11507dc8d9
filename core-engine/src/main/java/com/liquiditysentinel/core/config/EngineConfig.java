package com.liquiditysentinel.core.config;

import com.liquiditysentinel.core.alert.AlertConfig;
import com.liquiditysentinel.core.regime.RegimeThresholds;
import com.liquiditysentinel.core.regime.RegimeWeights;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section and key is optional):
 * </p>
 *
 * <pre>
 * alerts:
 *   vixPercentileRed: 90
 * regimeThresholds:
 *   creditGrowthExpansion: 3.0
 * regimeWeights:
 *   normalizationFactor: 0.7
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    private AlertConfig alerts = new AlertConfig();
    private RegimeThresholds regimeThresholds = new RegimeThresholds();
    private RegimeWeights regimeWeights = new RegimeWeights();

    public AlertConfig getAlerts() {
        return alerts;
    }

    /**
     * Set the alert thresholds (used by SnakeYAML during deserialization).
     *
     * @param alerts alert thresholds; {@code null} restores the defaults
     */
    public void setAlerts(AlertConfig alerts) {
        this.alerts = alerts != null ? alerts : new AlertConfig();
    }

    public RegimeThresholds getRegimeThresholds() {
        return regimeThresholds;
    }

    public void setRegimeThresholds(RegimeThresholds regimeThresholds) {
        this.regimeThresholds = regimeThresholds != null ? regimeThresholds : new RegimeThresholds();
    }

    public RegimeWeights getRegimeWeights() {
        return regimeWeights;
    }

    public void setRegimeWeights(RegimeWeights regimeWeights) {
        this.regimeWeights = regimeWeights != null ? regimeWeights : new RegimeWeights();
    }

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects the errors of all sections and throws a single exception if any
     * section is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more sections are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        collect(errors, alerts::validate);
        collect(errors, regimeThresholds::validate);
        collect(errors, regimeWeights::validate);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void collect(List<String> errors, Runnable validation) {
        try {
            validation.run();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{alerts=" + alerts
                + ", regimeThresholds=" + regimeThresholds
                + ", regimeWeights=" + regimeWeights + '}';
    }
}
