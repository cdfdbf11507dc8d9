/**
 * Stateless time-series transforms.
 *
 * <p>
 * {@link com.liquiditysentinel.core.transform.Transforms} holds the change,
 * z-score, percentile, inflection and rolling-statistics functions used by the
 * regime classifier, the alert rules and the balance-sheet diagnostics.
 * Insufficient history yields {@code NaN}, never an exception.
 * </p>
 *
 * @since 1.0.0
 */
package com.liquiditysentinel.core.transform;
