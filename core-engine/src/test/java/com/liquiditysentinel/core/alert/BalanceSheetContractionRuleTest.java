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
 * Unit tests for {@link BalanceSheetContractionRule}.
 */
class BalanceSheetContractionRuleTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC);

    private final BalanceSheetContractionRule rule = new BalanceSheetContractionRule(new AlertConfig(), CLOCK);

    @Test
    @DisplayName("Should fire Red when credit shrinks while spreads widen")
    void shouldFireRedWithWideningSpreads() {
        Optional<Alert> alert = rule.evaluate(IndicatorSet.resolve(Map.of(
                "bank_credit", credit(30, 0.998),
                "spread", widening(10))), null);

        assertThat(alert).isPresent();
        assertThat(alert.get().getLevel()).isEqualTo(AlertLevel.RED);
        assertThat(alert.get().getTitle()).isEqualTo("Balance Sheet Contraction");
        assertThat(alert.get().getWhatChanged())
                .startsWith("Bank credit 3M annualized -9.9%")
                .endsWith(", spread widened by 0.40pp");
    }

    @Test
    @DisplayName("Should fire Yellow when credit shrinks without spread widening")
    void shouldFireYellowWithoutSpread() {
        Optional<Alert> alert = rule.evaluate(IndicatorSet.resolve(Map.of("credit", credit(30, 0.998))), null);

        assertThat(alert).map(Alert::getLevel).contains(AlertLevel.YELLOW);
        assertThat(alert.get().getWhatChanged()).doesNotContain("spread");
    }

    @Test
    @DisplayName("Should stay silent while credit grows")
    void shouldNotFireOnGrowth() {
        assertThat(rule.evaluate(IndicatorSet.resolve(Map.of(
                "credit", credit(30, 1.002),
                "spread", widening(10))), null)).isEmpty();
    }

    @Test
    @DisplayName("Should fire Yellow on deceleration when that threshold sits above the credit threshold")
    void shouldFireOnDeceleration() {
        AlertConfig config = new AlertConfig();
        config.setCredit3mThreshold(-20.0);
        config.setCreditDecelerationThreshold(0.0);

        Optional<Alert> alert = new BalanceSheetContractionRule(config, CLOCK)
                .evaluate(IndicatorSet.resolve(Map.of("credit", credit(30, 0.998))), null);

        assertThat(alert).map(Alert::getLevel).contains(AlertLevel.YELLOW);
    }

    @Test
    @DisplayName("Should skip credit with less than six months of history")
    void shouldSkipShortHistory() {
        assertThat(rule.evaluate(IndicatorSet.resolve(Map.of(
                "credit", credit(BalanceSheetContractionRule.MIN_CREDIT_HISTORY - 1, 0.998))), null)).isEmpty();
    }

    @Test
    @DisplayName("Should evaluate as of an earlier date")
    void shouldHonourAsOf() {
        double[] values = new double[30];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < 20 ? 1000 * Math.pow(1.002, i) : 1000 * Math.pow(1.002, 19) * Math.pow(0.99, i - 19);
        }
        TimeSeries series = TimeSeries.regular("credit", LocalDate.of(2024, 1, 5), 7, values);
        IndicatorSet input = IndicatorSet.resolve(Map.of("credit", series));

        assertThat(rule.evaluate(input, series.dateAt(19))).isEmpty();
        assertThat(rule.evaluate(input, null)).isPresent();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static TimeSeries credit(int size, double weeklyFactor) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = 1000 * Math.pow(weeklyFactor, i);
        }
        return TimeSeries.regular("credit", LocalDate.of(2024, 1, 5), 7, values);
    }

    /** Spread rising 0.1pp per week. */
    private static TimeSeries widening(int size) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = 3.0 + 0.1 * i;
        }
        return TimeSeries.regular("spread", LocalDate.of(2024, 1, 5), 7, values);
    }
}
