package com.regressionsentinel.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of the alerting engine ({@code alerting:} section).
 *
 * <pre>
 * alerting:
 *   deliveryRetries: 1
 *   escalation:
 *     enabled: true
 *     timeToEscalateMinutes: 60
 *     escalationChannels: [email, chatops]
 *     maxEscalations: 3
 *   rateLimit:
 *     maxAlertsPerHour: 20
 *     maxAlertsPerDay: 100
 *   aggregation:
 *     enabled: true
 *     windowMinutes: 10
 *     maxAlertsToAggregate: 5
 *   channels:
 *     - name: console
 *       type: console
 * </pre>
 *
 * <p>
 * Templates not listed under {@code templates} fall back to the built-in
 * ones.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertingConfig {

    private List<AlertChannelConfig> channels = new ArrayList<>();
    private Escalation escalation = new Escalation();
    private RateLimit rateLimit = new RateLimit();
    private Aggregation aggregation = new Aggregation();
    private Map<String, AlertTemplate> templates = new LinkedHashMap<>();

    /** Extra attempts per channel after a failed delivery. */
    private int deliveryRetries = 1;

    /** Alerts older than this are pruned from history. */
    private int historyRetentionDays = 30;

    private int cleanupIntervalMinutes = 360;
    private int aggregationSweepMinutes = 5;

    /** Reported in webhook payload metadata. */
    private String environment = "development";

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section and every channel, collecting all problems.
     *
     * @throws IllegalStateException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < channels.size(); i++) {
            AlertChannelConfig channel = Objects.requireNonNull(channels.get(i),
                    "Channel at index " + i + " is null");
            try {
                channel.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (channel.getName() != null && !names.add(channel.getName())) {
                errors.add("Duplicate channel name '" + channel.getName() + "'");
            }
        }
        if (escalation.timeToEscalateMinutes <= 0) {
            errors.add("escalation.timeToEscalateMinutes must be > 0");
        }
        if (escalation.maxEscalations < 0) {
            errors.add("escalation.maxEscalations must be >= 0");
        }
        if (rateLimit.maxAlertsPerHour <= 0 || rateLimit.maxAlertsPerDay <= 0) {
            errors.add("rateLimit limits must be > 0");
        }
        if (aggregation.windowMinutes <= 0) {
            errors.add("aggregation.windowMinutes must be > 0");
        }
        if (aggregation.maxAlertsToAggregate < 2) {
            errors.add("aggregation.maxAlertsToAggregate must be >= 2");
        }
        if (deliveryRetries < 0) {
            errors.add("deliveryRetries must be >= 0");
        }
        if (historyRetentionDays <= 0) {
            errors.add("historyRetentionDays must be > 0");
        }
        if (cleanupIntervalMinutes <= 0 || aggregationSweepMinutes <= 0) {
            errors.add("cleanupIntervalMinutes and aggregationSweepMinutes must be > 0");
        }
        templates.forEach((name, template) -> {
            if (template == null || template.getBody() == null) {
                errors.add("Template '" + name + "' requires 'body'");
            }
        });

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public List<AlertChannelConfig> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public void setChannels(List<AlertChannelConfig> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public void setEscalation(Escalation escalation) {
        this.escalation = escalation != null ? escalation : new Escalation();
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit != null ? rateLimit : new RateLimit();
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation != null ? aggregation : new Aggregation();
    }

    public Map<String, AlertTemplate> getTemplates() {
        return Collections.unmodifiableMap(templates);
    }

    public void setTemplates(Map<String, AlertTemplate> templates) {
        this.templates = templates != null ? new LinkedHashMap<>(templates) : new LinkedHashMap<>();
    }

    public int getDeliveryRetries() {
        return deliveryRetries;
    }

    public void setDeliveryRetries(int deliveryRetries) {
        this.deliveryRetries = deliveryRetries;
    }

    public int getHistoryRetentionDays() {
        return historyRetentionDays;
    }

    public void setHistoryRetentionDays(int historyRetentionDays) {
        this.historyRetentionDays = historyRetentionDays;
    }

    public int getCleanupIntervalMinutes() {
        return cleanupIntervalMinutes;
    }

    public void setCleanupIntervalMinutes(int cleanupIntervalMinutes) {
        this.cleanupIntervalMinutes = cleanupIntervalMinutes;
    }

    public int getAggregationSweepMinutes() {
        return aggregationSweepMinutes;
    }

    public void setAggregationSweepMinutes(int aggregationSweepMinutes) {
        this.aggregationSweepMinutes = aggregationSweepMinutes;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    @Override
    public String toString() {
        return "AlertingConfig{channels=" + channels + ", deliveryRetries=" + deliveryRetries + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    public static class Escalation {
        private boolean enabled = true;
        private int timeToEscalateMinutes = 60;
        private List<String> escalationChannels = new ArrayList<>(List.of("email", "chatops"));
        private int maxEscalations = 3;

        public Duration timeToEscalate() {
            return Duration.ofMinutes(timeToEscalateMinutes);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTimeToEscalateMinutes() {
            return timeToEscalateMinutes;
        }

        public void setTimeToEscalateMinutes(int timeToEscalateMinutes) {
            this.timeToEscalateMinutes = timeToEscalateMinutes;
        }

        public List<String> getEscalationChannels() {
            return Collections.unmodifiableList(escalationChannels);
        }

        public void setEscalationChannels(List<String> escalationChannels) {
            this.escalationChannels = escalationChannels != null
                    ? new ArrayList<>(escalationChannels)
                    : new ArrayList<>();
        }

        public int getMaxEscalations() {
            return maxEscalations;
        }

        public void setMaxEscalations(int maxEscalations) {
            this.maxEscalations = maxEscalations;
        }
    }

    public static class RateLimit {
        private int maxAlertsPerHour = 20;
        private int maxAlertsPerDay = 100;

        public int getMaxAlertsPerHour() {
            return maxAlertsPerHour;
        }

        public void setMaxAlertsPerHour(int maxAlertsPerHour) {
            this.maxAlertsPerHour = maxAlertsPerHour;
        }

        public int getMaxAlertsPerDay() {
            return maxAlertsPerDay;
        }

        public void setMaxAlertsPerDay(int maxAlertsPerDay) {
            this.maxAlertsPerDay = maxAlertsPerDay;
        }
    }

    public static class Aggregation {
        private boolean enabled = true;
        private int windowMinutes = 10;
        private int maxAlertsToAggregate = 5;

        public Duration window() {
            return Duration.ofMinutes(windowMinutes);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWindowMinutes() {
            return windowMinutes;
        }

        public void setWindowMinutes(int windowMinutes) {
            this.windowMinutes = windowMinutes;
        }

        public int getMaxAlertsToAggregate() {
            return maxAlertsToAggregate;
        }

        public void setMaxAlertsToAggregate(int maxAlertsToAggregate) {
            this.maxAlertsToAggregate = maxAlertsToAggregate;
        }
    }
}
