package com.liquiditysentinel.core.transform;

/**
 * Reduction applied to the observations of one resampling bucket. Missing
 * observations are skipped.
 *
 * @since 1.0.0
 */
public enum Aggregation {
    LAST,
    MEAN,
    FIRST
}
