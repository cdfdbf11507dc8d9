package com.liquiditysentinel.core.model;

/**
 * Market-liquidity regime labels.
 *
 * <p>
 * Declaration order is significant: it breaks ties when two regimes share the
 * highest score.
 * </p>
 *
 * @since 1.0.0
 */
public enum Regime {

    EXPANSION("Expansion",
            "Credit and balance sheets expanding, spreads tightening, volatility stable - risk-on environment"),
    LATE_CYCLE("Late-cycle",
            "Credit still growing but valuation expansion outpacing earnings - watch for belief overheating"),
    CONTRACTION("Contraction",
            "Credit growth slowing or reversing, spreads widening, volatility rising - balance sheets shrinking"),
    STRESS("Stress",
            "Volatility spike, sharp spread widening and risk-asset drawdown - collateral impairment, credit crunch risk");

    private final String label;
    private final String description;

    Regime(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }
}
