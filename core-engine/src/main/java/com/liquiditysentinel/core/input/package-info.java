/**
 * Input boundary: maps caller-supplied indicator names onto canonical
 * {@link com.liquiditysentinel.core.input.IndicatorRole}s.
 *
 * @since 1.0.0
 */
package com.liquiditysentinel.core.input;
