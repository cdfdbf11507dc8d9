package com.liquiditysentinel.core.transform;

/**
 * How ties are handled when ranking a value within a window.
 *
 * @since 1.0.0
 */
public enum PercentileKind {

    /** Average of the strict and weak ranks; ties share the mean rank. */
    RANK,

    /** Share of window values less than or equal to the ranked value. */
    WEAK
}
