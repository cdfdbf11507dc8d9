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
 * Balance-sheet contraction: bank credit shrinking, worse when credit spreads
 * widen at the same time.
 *
 * <p>
 * Uses weekly data. Credit growth is the 3M annualized change over
 * {@value #CREDIT_PERIODS_3M} weeks; spread widening is a positive change over
 * the last {@value #SPREAD_CHANGE_PERIODS} weeks.
 * </p>
 * <ul>
 * <li>growth below the credit threshold with widening spreads: Red</li>
 * <li>growth below the credit threshold otherwise: Yellow</li>
 * <li>growth below the deceleration threshold: Yellow</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class BalanceSheetContractionRule implements AlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(BalanceSheetContractionRule.class);

    public static final String RULE_NAME = "balance_sheet_contraction";

    static final int CREDIT_PERIODS_3M = 13;
    static final int SPREAD_CHANGE_PERIODS = 4;

    /** Six months of weekly data. */
    static final int MIN_CREDIT_HISTORY = 26;

    private final AlertConfig config;
    private final Clock clock;

    /**
     * @param config alert thresholds, validated and copied; must not be
     *               {@code null}
     * @param clock  clock stamping fired alerts; must not be {@code null}
     * @throws IllegalStateException if {@code config} is invalid
     */
    public BalanceSheetContractionRule(AlertConfig config, Clock clock) {
        Objects.requireNonNull(config, "AlertConfig must not be null");
        config.validate();
        this.config = new AlertConfig(config);
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    @Override
    public Optional<Alert> evaluate(IndicatorSet indicators, LocalDate asOf) {
        Objects.requireNonNull(indicators, "IndicatorSet must not be null");

        Optional<TimeSeries> credit = indicators.get(IndicatorRole.CREDIT);
        if (credit.isEmpty() || credit.get().size() < MIN_CREDIT_HISTORY) {
            LOG.trace("Rule [{}]: credit missing or shorter than {} observations – skipping",
                    RULE_NAME, MIN_CREDIT_HISTORY);
            return Optional.empty();
        }

        double growth = Transforms.threeMonthAnnualized(credit.get(), CREDIT_PERIODS_3M).valueAsOf(asOf);
        if (Double.isNaN(growth)) {
            return Optional.empty();
        }

        double spreadChange = Double.NaN;
        Optional<TimeSeries> spread = indicators.get(IndicatorRole.SPREAD);
        if (spread.isPresent() && spread.get().size() > SPREAD_CHANGE_PERIODS) {
            spreadChange = Transforms.diff(spread.get(), SPREAD_CHANGE_PERIODS).valueAsOf(asOf);
        }
        boolean widening = spreadChange > 0;

        AlertLevel level;
        if (growth < config.getCredit3mThreshold()) {
            level = widening ? AlertLevel.RED : AlertLevel.YELLOW;
        } else if (growth < config.getCreditDecelerationThreshold()) {
            // Only reachable when the deceleration threshold is configured above the credit threshold.
            level = AlertLevel.YELLOW;
        } else {
            return Optional.empty();
        }

        String spreadNote = widening
                ? String.format(Locale.ROOT, ", spread widened by %.2fpp", spreadChange)
                : "";

        LOG.debug("Rule [{}] fired: level={} growth={} spreadChange={}", RULE_NAME, level, growth, spreadChange);
        return Optional.of(Alert.builder()
                .level(level)
                .ruleName(RULE_NAME)
                .title("Balance Sheet Contraction")
                .whatChanged(String.format(Locale.ROOT, "Bank credit 3M annualized %.1f%%", growth) + spreadNote)
                .vulnerabilityPath("credit contraction → asset price decline → collateral impairment"
                        + " → further credit contraction")
                .additionalChecks(List.of("M2 growth", "Fed balance sheet changes"))
                .timestamp(Instant.now(clock))
                .build());
    }

    @Override
    public String getRuleName() {
        return RULE_NAME;
    }
}
