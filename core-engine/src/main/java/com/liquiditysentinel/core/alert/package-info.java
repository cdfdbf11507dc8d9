/**
 * Rule-based vulnerability alerts.
 *
 * <p>
 * All rules implement the
 * {@link com.liquiditysentinel.core.alert.AlertRule} interface and are
 * instantiated via {@link com.liquiditysentinel.core.alert.AlertRuleFactory}.
 * Built-in rules:
 * </p>
 * <ul>
 * <li>{@link com.liquiditysentinel.core.alert.BeliefOverheatingRule} -
 * valuations re-rating faster than earnings</li>
 * <li>{@link com.liquiditysentinel.core.alert.CollateralStressRule} -
 * volatility, spreads and equities moving together</li>
 * <li>{@link com.liquiditysentinel.core.alert.BalanceSheetContractionRule} -
 * bank credit shrinking</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new rule, implement {@code AlertRule} and register its name in
 * {@code AlertRuleFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.liquiditysentinel.core.alert;
