package com.regressionsentinel.core.alerting;

import java.util.Collections;
import java.util.Map;

/**
 * Alert counts and delivery figures over a trailing window.
 */
public final class AlertStatistics {

    private final int totalAlerts;
    private final Map<String, Integer> alertsBySeverity;
    private final Map<String, Integer> alertsByChannel;
    private final double deliverySuccessRate;
    private final double averageDeliveryTimeMs;
    private final double escalationRate;

    public AlertStatistics(int totalAlerts, Map<String, Integer> alertsBySeverity,
                           Map<String, Integer> alertsByChannel, double deliverySuccessRate,
                           double averageDeliveryTimeMs, double escalationRate) {
        this.totalAlerts = totalAlerts;
        this.alertsBySeverity = Collections.unmodifiableMap(alertsBySeverity);
        this.alertsByChannel = Collections.unmodifiableMap(alertsByChannel);
        this.deliverySuccessRate = deliverySuccessRate;
        this.averageDeliveryTimeMs = averageDeliveryTimeMs;
        this.escalationRate = escalationRate;
    }

    public int getTotalAlerts() {
        return totalAlerts;
    }

    /** Counts for every severity label, zero included. */
    public Map<String, Integer> getAlertsBySeverity() {
        return alertsBySeverity;
    }

    public Map<String, Integer> getAlertsByChannel() {
        return alertsByChannel;
    }

    /** Percentage of alerts delivered on at least one channel. */
    public double getDeliverySuccessRate() {
        return deliverySuccessRate;
    }

    /** Mean time from alert creation to first successful delivery. */
    public double getAverageDeliveryTimeMs() {
        return averageDeliveryTimeMs;
    }

    /** Percentage of alerts escalated at least once. */
    public double getEscalationRate() {
        return escalationRate;
    }

    @Override
    public String toString() {
        return "AlertStatistics{total=" + totalAlerts
                + ", bySeverity=" + alertsBySeverity
                + ", byChannel=" + alertsByChannel
                + ", successRate=" + deliverySuccessRate
                + ", avgDeliveryMs=" + averageDeliveryTimeMs
                + ", escalationRate=" + escalationRate + '}';
    }
}
