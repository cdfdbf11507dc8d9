package com.liquiditysentinel.core.alert;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertRuleFactory}.
 */
class AlertRuleFactoryTest {

    private final AlertConfig config = new AlertConfig();
    private final Clock clock = Clock.systemUTC();

    @Test
    @DisplayName("Should create each built-in rule by name")
    void shouldCreateBuiltInRules() {
        assertThat(AlertRuleFactory.create("belief_overheating", config, clock))
                .isInstanceOf(BeliefOverheatingRule.class);
        assertThat(AlertRuleFactory.create("collateral_stress", config, clock))
                .isInstanceOf(CollateralStressRule.class);
        assertThat(AlertRuleFactory.create("balance_sheet_contraction", config, clock))
                .isInstanceOf(BalanceSheetContractionRule.class);
    }

    @Test
    @DisplayName("Should match rule names case-insensitively")
    void shouldIgnoreCase() {
        assertThat(AlertRuleFactory.create("COLLATERAL_STRESS", config, clock).getRuleName())
                .isEqualTo(CollateralStressRule.RULE_NAME);
    }

    @Test
    @DisplayName("Should reject an unknown rule name and list the supported ones")
    void shouldRejectUnknownRule() {
        assertThatThrownBy(() -> AlertRuleFactory.create("margin_spiral", config, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("margin_spiral")
                .hasMessageContaining("belief_overheating");
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNulls() {
        assertThatThrownBy(() -> AlertRuleFactory.create(null, config, clock))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> AlertRuleFactory.create("collateral_stress", null, clock))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should create the defaults in evaluation order")
    void shouldCreateDefaultsInOrder() {
        List<AlertRule> rules = AlertRuleFactory.createDefaults(config, clock);

        assertThat(rules).extracting(AlertRule::getRuleName)
                .containsExactly("belief_overheating", "collateral_stress", "balance_sheet_contraction");
    }

    @Test
    @DisplayName("Should return an unmodifiable list")
    void shouldReturnUnmodifiableList() {
        List<AlertRule> rules = AlertRuleFactory.createAll(List.of("collateral_stress"), config, clock);

        assertThatThrownBy(rules::clear).isInstanceOf(UnsupportedOperationException.class);
    }
}
