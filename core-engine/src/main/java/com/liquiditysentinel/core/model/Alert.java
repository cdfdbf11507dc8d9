package com.liquiditysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Alert emitted when a monitoring rule fires.
 *
 * <p>
 * Alerts describe a vulnerability worth watching, never a causal claim about
 * price moves. They are immutable once built.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code level}, {@code ruleName} and {@code timestamp} are present; omitting
 * any of them throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"level", "ruleName", "title", "whatChanged", "vulnerabilityPath",
        "additionalChecks", "timestamp"})
public final class Alert {

    /** Maximum number of follow-up checks carried by an alert. */
    public static final int MAX_ADDITIONAL_CHECKS = 2;

    private final AlertLevel level;

    /** Name of the rule that triggered the alert. */
    private final String ruleName;

    private final String title;

    /** Templated, numeric description of what moved. */
    private final String whatChanged;

    /** Narrative of the path through which the move could propagate. */
    private final String vulnerabilityPath;

    /** Suggested follow-up indicators to check. */
    private final List<String> additionalChecks;

    /** When the alert was created. */
    private final Instant timestamp;

    private Alert(Builder builder) {
        this.level = Objects.requireNonNull(builder.level, "level must not be null");
        this.ruleName = Objects.requireNonNull(builder.ruleName, "ruleName must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.title = builder.title;
        this.whatChanged = builder.whatChanged;
        this.vulnerabilityPath = builder.vulnerabilityPath;
        List<String> checks = builder.additionalChecks != null ? builder.additionalChecks : List.of();
        this.additionalChecks = List.copyOf(checks.size() > MAX_ADDITIONAL_CHECKS
                ? checks.subList(0, MAX_ADDITIONAL_CHECKS)
                : checks);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     *
     * <p>
     * {@code level}, {@code ruleName} and {@code timestamp} are
     * <strong>required</strong>. Follow-up checks beyond
     * {@value #MAX_ADDITIONAL_CHECKS} are dropped.
     * </p>
     */
    public static class Builder {
        private AlertLevel level;
        private String ruleName;
        private String title;
        private String whatChanged;
        private String vulnerabilityPath;
        private List<String> additionalChecks;
        private Instant timestamp;

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder whatChanged(String whatChanged) {
            this.whatChanged = whatChanged;
            return this;
        }

        public Builder vulnerabilityPath(String vulnerabilityPath) {
            this.vulnerabilityPath = vulnerabilityPath;
            return this;
        }

        public Builder additionalChecks(List<String> additionalChecks) {
            this.additionalChecks = additionalChecks;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code level}, {@code ruleName} or
         *                              {@code timestamp} is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public AlertLevel getLevel() {
        return level;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getTitle() {
        return title;
    }

    public String getWhatChanged() {
        return whatChanged;
    }

    public String getVulnerabilityPath() {
        return vulnerabilityPath;
    }

    /**
     * @return unmodifiable list of at most {@value #MAX_ADDITIONAL_CHECKS} checks
     */
    public List<String> getAdditionalChecks() {
        return additionalChecks;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Render the alert as a single line in the standard message layout.
     *
     * @return e.g. {@code [Red] Collateral stress: ... -> Vulnerability path: ... Additional checks: a, b}
     */
    @JsonIgnore
    public String formatMessage() {
        return "[" + level.getLabel() + "] " + title + ": "
                + whatChanged + " -> "
                + "Vulnerability path: " + vulnerabilityPath + ". "
                + "Additional checks: " + String.join(", ", additionalChecks);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return level == alert.level
                && Objects.equals(ruleName, alert.ruleName)
                && Objects.equals(title, alert.title)
                && Objects.equals(whatChanged, alert.whatChanged)
                && Objects.equals(vulnerabilityPath, alert.vulnerabilityPath)
                && Objects.equals(additionalChecks, alert.additionalChecks)
                && Objects.equals(timestamp, alert.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, ruleName, title, whatChanged, vulnerabilityPath, additionalChecks, timestamp);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "level=" + level +
                ", ruleName='" + ruleName + '\'' +
                ", timestamp=" + timestamp +
                ", whatChanged='" + whatChanged + '\'' +
                '}';
    }
}
