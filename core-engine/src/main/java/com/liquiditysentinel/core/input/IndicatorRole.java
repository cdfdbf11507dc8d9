package com.liquiditysentinel.core.input;

import java.util.List;

/**
 * Canonical indicator roles understood by the analytics engine.
 *
 * <p>
 * Each role lists the input names accepted for it, in order of preference.
 * </p>
 *
 * @since 1.0.0
 */
public enum IndicatorRole {

    /** Bank credit or a similar balance-sheet aggregate. */
    CREDIT("credit_growth", "credit", "bank_credit"),

    /** Credit spread (high yield or investment grade). */
    SPREAD("spread", "hy_spread"),

    /** Equity implied volatility index. */
    VIX("vix"),

    /** Equity index level. */
    EQUITY("equity", "sp500"),

    /** Valuation level, e.g. a P/E ratio. */
    VALUATION("valuation", "pe_ratio"),

    /** Earnings level, e.g. forward EPS. */
    EARNINGS("earnings", "forward_eps"),

    /** Pre-computed valuation z-score. */
    VALUATION_ZSCORE("valuation_zscore"),

    /** Pre-computed earnings z-score. */
    EARNINGS_ZSCORE("earnings_zscore");

    /** Roles whose presence is checked by the data-quality assessment. */
    public static final List<IndicatorRole> CORE_ROLES = List.of(CREDIT, SPREAD, VIX);

    private final List<String> aliases;

    IndicatorRole(String... aliases) {
        this.aliases = List.of(aliases);
    }

    /**
     * @return accepted input names, most preferred first
     */
    public List<String> getAliases() {
        return aliases;
    }

    public String canonicalName() {
        return aliases.get(0);
    }
}
