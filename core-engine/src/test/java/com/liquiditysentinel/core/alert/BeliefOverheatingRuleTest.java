package com.liquiditysentinel.core.alert;

import com.liquiditysentinel.core.input.IndicatorSet;
import com.liquiditysentinel.core.model.Alert;
import com.liquiditysentinel.core.model.AlertLevel;
import com.liquiditysentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BeliefOverheatingRule}.
 */
class BeliefOverheatingRuleTest {

    private static final Instant NOW = Instant.parse("2024-06-30T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final int SIZE = 420;

    @Test
    @DisplayName("Should fire Red when valuations re-rate far ahead of earnings")
    void shouldFireRed() {
        Optional<Alert> alert = new BeliefOverheatingRule(new AlertConfig(), CLOCK)
                .evaluate(indicators(reratingValuation(), steadyEarnings()), null);

        assertThat(alert).isPresent();
        assertThat(alert.get().getLevel()).isEqualTo(AlertLevel.RED);
        assertThat(alert.get().getRuleName()).isEqualTo(BeliefOverheatingRule.RULE_NAME);
        assertThat(alert.get().getTitle()).isEqualTo("Belief Overheating");
        assertThat(alert.get().getWhatChanged())
                .isEqualTo("Valuation z-score rising 7.89σ faster than earnings expectations");
        assertThat(alert.get().getAdditionalChecks())
                .containsExactly("Forward EPS revision trend", "Analyst consensus changes");
        assertThat(alert.get().getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should fire Yellow when the gap sits between the thresholds")
    void shouldFireYellow() {
        AlertConfig config = new AlertConfig();
        config.setBeliefZscoreGapYellow(5.0);
        config.setBeliefZscoreGapRed(10.0);

        Optional<Alert> alert = new BeliefOverheatingRule(config, CLOCK)
                .evaluate(indicators(reratingValuation(), steadyEarnings()), null);

        assertThat(alert).map(Alert::getLevel).contains(AlertLevel.YELLOW);
    }

    @Test
    @DisplayName("Should stay silent when valuations and earnings move together")
    void shouldNotFireWithoutGap() {
        TimeSeries valuation = reratingValuation();
        TimeSeries earnings = valuation.withValues("earnings", valuation.values());

        assertThat(new BeliefOverheatingRule(new AlertConfig(), CLOCK)
                .evaluate(indicators(valuation, earnings), null)).isEmpty();
    }

    @Test
    @DisplayName("Should skip inputs shorter than a year")
    void shouldSkipShortHistory() {
        TimeSeries shortValuation = daily("valuation", new double[BeliefOverheatingRule.MIN_HISTORY - 1]);

        assertThat(new BeliefOverheatingRule(new AlertConfig(), CLOCK)
                .evaluate(indicators(shortValuation, steadyEarnings()), null)).isEmpty();
    }

    @Test
    @DisplayName("Should skip when earnings are missing")
    void shouldSkipMissingEarnings() {
        IndicatorSet onlyValuation = IndicatorSet.resolve(Map.of("valuation", reratingValuation()));

        assertThat(new BeliefOverheatingRule(new AlertConfig(), CLOCK).evaluate(onlyValuation, null)).isEmpty();
    }

    @Test
    @DisplayName("Should produce identical alerts for identical inputs and clock")
    void shouldBeDeterministic() {
        BeliefOverheatingRule rule = new BeliefOverheatingRule(new AlertConfig(), CLOCK);
        IndicatorSet input = indicators(reratingValuation(), steadyEarnings());

        assertThat(rule.evaluate(input, null)).isEqualTo(rule.evaluate(input, null));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static IndicatorSet indicators(TimeSeries valuation, TimeSeries earnings) {
        return IndicatorSet.resolve(Map.of("pe_ratio", valuation, "forward_eps", earnings));
    }

    /** Range-bound valuation that climbs steadily over the final month. */
    private static TimeSeries reratingValuation() {
        double[] values = new double[SIZE];
        for (int i = 0; i < SIZE - 21; i++) {
            values[i] = 100 + (i % 2);
        }
        for (int k = 0; k < 21; k++) {
            values[SIZE - 21 + k] = 101 + (k + 1) * 0.5;
        }
        return daily("valuation", values);
    }

    private static TimeSeries steadyEarnings() {
        double[] values = new double[SIZE];
        for (int i = 0; i < SIZE; i++) {
            values[i] = 50 + 0.01 * i;
        }
        return daily("earnings", values);
    }

    private static TimeSeries daily(String name, double[] values) {
        return TimeSeries.regular(name, LocalDate.of(2023, 1, 1), 1, values);
    }
}
