/**
 * JSON rendering of analytics results.
 *
 * @since 1.0.0
 */
package com.liquiditysentinel.core.report;
