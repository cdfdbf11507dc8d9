package com.liquiditysentinel.core.alert;

import com.liquiditysentinel.core.input.IndicatorSet;
import com.liquiditysentinel.core.model.Alert;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Contract for all alert rules.
 * <p>
 * Rules are <strong>stateless</strong>: each call evaluates the supplied
 * indicators as of one date and decides whether a vulnerability is building.
 * Missing inputs or insufficient history mean no alert, never an exception.
 * </p>
 */
public interface AlertRule {

    /**
     * Evaluate the rule.
     *
     * @param indicators resolved indicator series
     * @param asOf       evaluation date, {@code null} for the latest
     *                   observations
     * @return an {@link Alert} if the rule fires, empty otherwise
     */
    Optional<Alert> evaluate(IndicatorSet indicators, LocalDate asOf);

    /**
     * Return the unique name of this rule.
     *
     * @return rule name
     */
    String getRuleName();
}
