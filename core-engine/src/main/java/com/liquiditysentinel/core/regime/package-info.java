/**
 * Point-in-time market regime classification.
 *
 * <p>
 * {@link com.liquiditysentinel.core.regime.RegimeClassifier} scores the
 * Expansion, Late-cycle, Contraction and Stress regimes from credit, spread,
 * volatility, equity and valuation inputs. Cutoffs and point weights are
 * configurable through
 * {@link com.liquiditysentinel.core.regime.RegimeThresholds} and
 * {@link com.liquiditysentinel.core.regime.RegimeWeights}.
 * </p>
 *
 * @since 1.0.0
 */
package com.liquiditysentinel.core.regime;
