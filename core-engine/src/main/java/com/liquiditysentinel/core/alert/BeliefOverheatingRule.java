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
 * Belief overheating: valuations re-rating faster than earnings expectations.
 *
 * <p>
 * Compares the 1M change of the 3-year valuation z-score with the same change
 * for earnings. A gap at or above the Red threshold raises Red, at or above
 * the Yellow threshold raises Yellow. Both series need a year of daily
 * history.
 * </p>
 *
 * @since 1.0.0
 */
public class BeliefOverheatingRule implements AlertRule {

    private static final Logger LOG = LoggerFactory.getLogger(BeliefOverheatingRule.class);

    public static final String RULE_NAME = "belief_overheating";

    static final int MIN_HISTORY = Transforms.DAILY_PERIODS_PER_YEAR;

    private final AlertConfig config;
    private final Clock clock;

    /**
     * @param config alert thresholds, validated and copied; must not be
     *               {@code null}
     * @param clock  clock stamping fired alerts; must not be {@code null}
     * @throws IllegalStateException if {@code config} is invalid
     */
    public BeliefOverheatingRule(AlertConfig config, Clock clock) {
        Objects.requireNonNull(config, "AlertConfig must not be null");
        config.validate();
        this.config = new AlertConfig(config);
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    @Override
    public Optional<Alert> evaluate(IndicatorSet indicators, LocalDate asOf) {
        Objects.requireNonNull(indicators, "IndicatorSet must not be null");

        Optional<TimeSeries> valuation = indicators.get(IndicatorRole.VALUATION);
        Optional<TimeSeries> earnings = indicators.get(IndicatorRole.EARNINGS);
        if (valuation.isEmpty() || earnings.isEmpty()) {
            LOG.trace("Rule [{}]: valuation or earnings missing – skipping", RULE_NAME);
            return Optional.empty();
        }
        if (valuation.get().size() < MIN_HISTORY || earnings.get().size() < MIN_HISTORY) {
            LOG.trace("Rule [{}]: less than {} observations – skipping", RULE_NAME, MIN_HISTORY);
            return Optional.empty();
        }

        double valuationChange = Transforms.zscoreChange(valuation.get()).valueAsOf(asOf);
        double earningsChange = Transforms.zscoreChange(earnings.get()).valueAsOf(asOf);
        if (Double.isNaN(valuationChange) || Double.isNaN(earningsChange)) {
            return Optional.empty();
        }

        double gap = valuationChange - earningsChange;
        AlertLevel level;
        if (gap >= config.getBeliefZscoreGapRed()) {
            level = AlertLevel.RED;
        } else if (gap >= config.getBeliefZscoreGapYellow()) {
            level = AlertLevel.YELLOW;
        } else {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: level={} gap={}", RULE_NAME, level, gap);
        return Optional.of(Alert.builder()
                .level(level)
                .ruleName(RULE_NAME)
                .title("Belief Overheating")
                .whatChanged(String.format(Locale.ROOT,
                        "Valuation z-score rising %.2fσ faster than earnings expectations", gap))
                .vulnerabilityPath("valuation expansion → sharp reversal risk on earnings miss")
                .additionalChecks(List.of("Forward EPS revision trend", "Analyst consensus changes"))
                .timestamp(Instant.now(clock))
                .build());
    }

    @Override
    public String getRuleName() {
        return RULE_NAME;
    }
}
