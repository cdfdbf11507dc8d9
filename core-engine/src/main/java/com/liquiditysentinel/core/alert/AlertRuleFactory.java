package com.liquiditysentinel.core.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link AlertRule} instances by rule name.
 *
 * <p>
 * This is the single point of extension when adding new alert rules:
 * register the new name here and create the corresponding rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AlertRuleFactory.class);

    /** Built-in rules in evaluation order. */
    public static final List<String> DEFAULT_RULES = List.of(
            BeliefOverheatingRule.RULE_NAME,
            CollateralStressRule.RULE_NAME,
            BalanceSheetContractionRule.RULE_NAME);

    private AlertRuleFactory() {
        // utility class
    }

    /**
     * Create the rule registered under {@code name}.
     *
     * @param name   rule name; must not be {@code null}
     * @param config alert thresholds; must not be {@code null}
     * @param clock  clock stamping fired alerts; must not be {@code null}
     * @return the rule
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AlertRule create(String name, AlertConfig config, Clock clock) {
        Objects.requireNonNull(name, "Rule name must not be null");
        Objects.requireNonNull(config, "AlertConfig must not be null");
        Objects.requireNonNull(clock, "Clock must not be null");

        return switch (name.toLowerCase(Locale.ROOT)) {
            case BeliefOverheatingRule.RULE_NAME -> new BeliefOverheatingRule(config, clock);
            case CollateralStressRule.RULE_NAME -> new CollateralStressRule(config, clock);
            case BalanceSheetContractionRule.RULE_NAME -> new BalanceSheetContractionRule(config, clock);
            default -> throw new IllegalArgumentException(
                    "Unknown alert rule: '" + name + "'. Supported rules: " + String.join(", ", DEFAULT_RULES));
        };
    }

    /**
     * Create rules for every name in the supplied list, preserving order.
     *
     * @param names  rule names; must not be {@code null}
     * @param config alert thresholds
     * @param clock  clock stamping fired alerts
     * @return unmodifiable list of rules (one per name)
     */
    public static List<AlertRule> createAll(List<String> names, AlertConfig config, Clock clock) {
        Objects.requireNonNull(names, "Rule names must not be null");
        LOG.info("Creating {} alert rule(s)", names.size());
        List<AlertRule> rules = names.stream()
                .map(name -> create(name, config, clock))
                .toList();
        return Collections.unmodifiableList(rules);
    }

    /**
     * @param config alert thresholds
     * @param clock  clock stamping fired alerts
     * @return the built-in rules in evaluation order
     */
    public static List<AlertRule> createDefaults(AlertConfig config, Clock clock) {
        return createAll(DEFAULT_RULES, config, clock);
    }
}
