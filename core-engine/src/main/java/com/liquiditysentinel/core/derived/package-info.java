/**
 * Derived balance-sheet metrics.
 *
 * <p>
 * {@link com.liquiditysentinel.core.derived.BalanceSheetDiagnostics} turns Fed
 * balance-sheet series into labelled, scored
 * {@link com.liquiditysentinel.core.derived.DiagnosticBundle}s. All band
 * scoring goes through one
 * {@link com.liquiditysentinel.core.derived.PiecewiseScorer}.
 * </p>
 *
 * @since 1.0.0
 */
package com.liquiditysentinel.core.derived;
