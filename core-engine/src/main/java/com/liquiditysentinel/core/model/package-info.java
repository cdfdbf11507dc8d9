/**
 * Domain model classes for Liquidity Sentinel.
 *
 * <p>
 * This package contains the plain data types exchanged between the analytics
 * components and their callers:
 * </p>
 * <ul>
 * <li>{@link com.liquiditysentinel.core.model.TimeSeries} — immutable
 * date-indexed observations</li>
 * <li>{@link com.liquiditysentinel.core.model.MetricSnapshot} — named scalars
 * as of a date</li>
 * <li>{@link com.liquiditysentinel.core.model.RegimeResult} — regime
 * classification outcome</li>
 * <li>{@link com.liquiditysentinel.core.model.Alert} — monitoring alert
 * emitted by the alert engine</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.liquiditysentinel.core.model;
