package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Regression alert raised when a test run degrades against its baseline or
 * when the visual regression service reports a failing comparison.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code timestamp}, {@code severity} and
 * {@code testName} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * An alert is unacknowledged when created. Acknowledging it records who did
 * it and when; resolving it records {@code resolvedAt}. Both are mutations
 * owned by the alerting engine.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Alert {

    private String id;
    private Instant timestamp;
    private AlertSeverity severity;
    private String testType;
    private String testName;

    /** Baseline comparison behind the alert; {@code null} for visual alerts. */
    private BaselineComparison comparison;

    /** Names of the channels this alert may be delivered to. */
    private List<String> alertChannels = new ArrayList<>();

    private boolean acknowledged;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private Instant resolvedAt;
    private String notes;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    protected Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.testName = Objects.requireNonNull(builder.testName, "testName must not be null");
        this.testType = builder.testType;
        this.comparison = builder.comparison;
        this.alertChannels = new ArrayList<>(builder.alertChannels);
    }

    /**
     * Copy constructor; used when an alert is enriched for delivery.
     *
     * @param other alert to copy
     */
    protected Alert(Alert other) {
        this.id = other.id;
        this.timestamp = other.timestamp;
        this.severity = other.severity;
        this.testType = other.testType;
        this.testName = other.testName;
        this.comparison = other.comparison;
        this.alertChannels = new ArrayList<>(other.alertChannels);
        this.acknowledged = other.acknowledged;
        this.acknowledgedBy = other.acknowledgedBy;
        this.acknowledgedAt = other.acknowledgedAt;
        this.resolvedAt = other.resolvedAt;
        this.notes = other.notes;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private Instant timestamp;
        private AlertSeverity severity;
        private String testType;
        private String testName;
        private BaselineComparison comparison;
        private List<String> alertChannels = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder testType(String testType) {
            this.testType = testType;
            return this;
        }

        public Builder testName(String testName) {
            this.testName = testName;
            return this;
        }

        public Builder comparison(BaselineComparison comparison) {
            this.comparison = comparison;
            return this;
        }

        public Builder alertChannels(List<String> alertChannels) {
            this.alertChannels = alertChannels != null ? new ArrayList<>(alertChannels) : new ArrayList<>();
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public void setSeverity(AlertSeverity severity) {
        this.severity = severity;
    }

    public String getTestType() {
        return testType;
    }

    public void setTestType(String testType) {
        this.testType = testType;
    }

    public String getTestName() {
        return testName;
    }

    public void setTestName(String testName) {
        this.testName = testName;
    }

    public BaselineComparison getComparison() {
        return comparison;
    }

    public void setComparison(BaselineComparison comparison) {
        this.comparison = comparison;
    }

    /**
     * @return unmodifiable view of the target channel names
     */
    public List<String> getAlertChannels() {
        return Collections.unmodifiableList(alertChannels);
    }

    public void setAlertChannels(List<String> alertChannels) {
        this.alertChannels = alertChannels != null ? new ArrayList<>(alertChannels) : new ArrayList<>();
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    public void setAcknowledged(boolean acknowledged) {
        this.acknowledged = acknowledged;
    }

    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public void setAcknowledgedBy(String acknowledgedBy) {
        this.acknowledgedBy = acknowledgedBy;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public void setAcknowledgedAt(Instant acknowledgedAt) {
        this.acknowledgedAt = acknowledgedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
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
        return Objects.equals(id, alert.id)
                && Objects.equals(timestamp, alert.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "id='" + id + '\'' +
                ", severity=" + severity +
                ", testType='" + testType + '\'' +
                ", testName='" + testName + '\'' +
                ", timestamp=" + timestamp +
                ", acknowledged=" + acknowledged +
                '}';
    }
}
