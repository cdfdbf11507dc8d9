package com.liquiditysentinel.core.alert;

import com.liquiditysentinel.core.input.IndicatorRole;
import com.liquiditysentinel.core.input.IndicatorSet;
import com.liquiditysentinel.core.model.Alert;
import com.liquiditysentinel.core.model.AlertLevel;
import com.liquiditysentinel.core.model.TimeSeries;
import com.liquiditysentinel.core.transform.Transforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Collateral stress: volatility, credit spreads and equity prices moving
 * against leveraged holders at once.
 *
 * <p>
 * Three signals are checked: the 3-year VIX percentile (daily), the 3-year
 * spread percentile (weekly) and the 1M equity return. Two or more signals at
 * Red severity raise Red; otherwise two or more at Yellow severity raise
 * Yellow.
 * </p>
 *
 * @since 1.0.0
 */
public class CollateralStressRule implements AlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(CollateralStressRule.class);

    public static final String RULE_NAME = "collateral_stress";

    /** Signals that must agree before the rule fires. */
    static final int MIN_SIGNALS = 2;

    private final AlertConfig config;
    private final Clock clock;

    /**
     * @param config alert thresholds, validated and copied; must not be
     *               {@code null}
     * @param clock  clock stamping fired alerts; must not be {@code null}
     * @throws IllegalStateException if {@code config} is invalid
     */
    public CollateralStressRule(AlertConfig config, Clock clock) {
        Objects.requireNonNull(config, "AlertConfig must not be null");
        config.validate();
        this.config = new AlertConfig(config);
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    @Override
    public Optional<Alert> evaluate(IndicatorSet indicators, LocalDate asOf) {
        Objects.requireNonNull(indicators, "IndicatorSet must not be null");

        Optional<TimeSeries> vix = indicators.get(IndicatorRole.VIX);
        Optional<TimeSeries> spread = indicators.get(IndicatorRole.SPREAD);
        Optional<TimeSeries> equity = indicators.get(IndicatorRole.EQUITY);
        if (vix.isEmpty() || spread.isEmpty() || equity.isEmpty()) {
            LOG.trace("Rule [{}]: vix, spread or equity missing – skipping", RULE_NAME);
            return Optional.empty();
        }
        if (vix.get().size() <= 3 * Transforms.DAILY_PERIODS_PER_YEAR
                || spread.get().size() <= 3 * Transforms.WEEKLY_PERIODS_PER_YEAR
                || equity.get().size() <= Transforms.DAILY_PERIODS_1M) {
            LOG.trace("Rule [{}]: insufficient history – skipping", RULE_NAME);
            return Optional.empty();
        }

        double vixPct = Transforms.percentile(vix.get(), 3, Transforms.DAILY_PERIODS_PER_YEAR).valueAsOf(asOf);
        double spreadPct = Transforms.percentile(spread.get(), 3, Transforms.WEEKLY_PERIODS_PER_YEAR)
                .valueAsOf(asOf);
        double equity1m = Transforms.oneMonthChange(equity.get()).valueAsOf(asOf);
        if (Double.isNaN(vixPct) || Double.isNaN(spreadPct) || Double.isNaN(equity1m)) {
            return Optional.empty();
        }

        int redSignals = count(vixPct >= config.getVixPercentileRed(),
                spreadPct >= config.getSpreadPercentileRed(),
                equity1m <= config.getEquityDrawdownRed());
        int yellowSignals = count(vixPct >= config.getVixPercentileYellow(),
                spreadPct >= config.getSpreadPercentileYellow(),
                equity1m <= config.getEquityDrawdownYellow());

        AlertLevel level;
        if (redSignals >= MIN_SIGNALS) {
            level = AlertLevel.RED;
        } else if (yellowSignals >= MIN_SIGNALS) {
            level = AlertLevel.YELLOW;
        } else {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: level={} vixPct={} spreadPct={} equity1m={}",
                RULE_NAME, level, vixPct, spreadPct, equity1m);
        return Optional.of(Alert.builder()
                .level(level)
                .ruleName(RULE_NAME)
                .title("Collateral Stress")
                .whatChanged(String.format(Locale.ROOT,
                        "VIX at %.0fth percentile, spread at %.0fth percentile, equity 1M %.1f%%",
                        vixPct, spreadPct, equity1m))
                .vulnerabilityPath("collateral value falls → margin calls → forced liquidation → further declines")
                .additionalChecks(List.of("Leveraged ETF fund flows", "High-yield issuance halts"))
                .timestamp(Instant.now(clock))
                .build());
    }

    @Override
    public String getRuleName() {
        return RULE_NAME;
    }

    private static int count(boolean... signals) {
        int n = 0;
        for (boolean signal : signals) {
            if (signal) {
                n++;
            }
        }
        return n;
    }
}
