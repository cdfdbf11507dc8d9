package com.liquiditysentinel.core.alert;

import com.liquiditysentinel.core.input.IndicatorSet;
import com.liquiditysentinel.core.model.Alert;
import com.liquiditysentinel.core.model.AlertLevel;
import com.liquiditysentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates the alert rules and keeps the history of fired alerts.
 *
 * <h3>Isolation</h3>
 * <p>
 * Every rule is evaluated on every call, in registration order. A rule that
 * throws is logged at ERROR and skipped; the remaining rules still run.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The history is append-only and held in memory. The engine is not
 * thread-safe; use one instance per caller thread.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEngine.class);

    /** Number of most recent alerts covered by {@link #getSummary()}. */
    static final int SUMMARY_WINDOW = 10;

    private final List<AlertRule> rules;
    private final List<Alert> history = new ArrayList<>();

    /**
     * @param rules rules in evaluation order; must not be {@code null}
     */
    public AlertEngine(List<AlertRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Rules must not be null"));
    }

    /**
     * @param config alert thresholds
     * @param clock  clock stamping fired alerts
     * @return an engine running the built-in rules
     */
    public static AlertEngine withDefaultRules(AlertConfig config, Clock clock) {
        return new AlertEngine(AlertRuleFactory.createDefaults(config, clock));
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Evaluate every rule against named indicator series.
     *
     * @param data indicator name or alias to series
     * @param asOf evaluation date, {@code null} for the latest observations
     * @return alerts fired by this call, in rule order
     */
    public List<Alert> checkAllAlerts(Map<String, TimeSeries> data, LocalDate asOf) {
        return checkAllAlerts(IndicatorSet.resolve(data), asOf);
    }

    /**
     * Evaluate every rule against resolved indicators and append fired alerts
     * to the history.
     *
     * @param indicators resolved indicator set; must not be {@code null}
     * @param asOf       evaluation date, {@code null} for the latest
     *                   observations
     * @return alerts fired by this call, in rule order
     */
    public List<Alert> checkAllAlerts(IndicatorSet indicators, LocalDate asOf) {
        Objects.requireNonNull(indicators, "IndicatorSet must not be null");
        List<Alert> fired = new ArrayList<>();

        for (AlertRule rule : rules) {
            Optional<Alert> alert;
            try {
                alert = rule.evaluate(indicators, asOf);
            } catch (RuntimeException e) {
                LOG.error("Rule [{}] failed and was skipped", rule.getRuleName(), e);
                continue;
            }
            alert.ifPresent(fired::add);
        }

        history.addAll(fired);
        LOG.debug("{} of {} rule(s) fired, history size {}", fired.size(), rules.size(), history.size());
        return Collections.unmodifiableList(fired);
    }

    /**
     * @param n maximum number of alerts to return
     * @return up to {@code n} alerts, most recent first
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public List<Alert> getRecentAlerts(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got: " + n);
        }
        int from = Math.max(0, history.size() - n);
        List<Alert> recent = new ArrayList<>(history.subList(from, history.size()));
        Collections.reverse(recent);
        return Collections.unmodifiableList(recent);
    }

    /**
     * Count alerts per level over the last {@value #SUMMARY_WINDOW} alerts.
     *
     * @return count for every level, including zero counts
     */
    public Map<AlertLevel, Integer> getSummary() {
        Map<AlertLevel, Integer> summary = new EnumMap<>(AlertLevel.class);
        for (AlertLevel level : AlertLevel.values()) {
            summary.put(level, 0);
        }
        for (Alert alert : history.subList(Math.max(0, history.size() - SUMMARY_WINDOW), history.size())) {
            summary.merge(alert.getLevel(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(summary);
    }

    /**
     * @return unmodifiable view of every fired alert, oldest first
     */
    public List<Alert> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public List<AlertRule> getRules() {
        return rules;
    }
}
