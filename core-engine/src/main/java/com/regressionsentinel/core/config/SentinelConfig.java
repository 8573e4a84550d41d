package com.regressionsentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for {@code sentinel.yml}.
 *
 * <pre>
 * statistics:
 *   trendWindowDays: 30
 *   anomalySensitivity: medium
 * alerting:
 *   channels:
 *     - name: console
 *       type: console
 * </pre>
 *
 * <p>
 * Both sections are optional and default to the built-in settings. Call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig {

    private StatisticalConfig statistics = new StatisticalConfig();
    private AlertingConfig alerting = new AlertingConfig();

    public static SentinelConfig defaults() {
        return new SentinelConfig();
    }

    /**
     * Validate both sections, collecting every error into one exception.
     *
     * @throws IllegalStateException if either section is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            statistics.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        try {
            alerting.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Sentinel configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public StatisticalConfig getStatistics() {
        return statistics;
    }

    public void setStatistics(StatisticalConfig statistics) {
        this.statistics = statistics != null ? statistics : new StatisticalConfig();
    }

    public AlertingConfig getAlerting() {
        return alerting;
    }

    public void setAlerting(AlertingConfig alerting) {
        this.alerting = alerting != null ? alerting : new AlertingConfig();
    }

    @Override
    public String toString() {
        return "SentinelConfig{statistics=" + statistics + ", alerting=" + alerting + '}';
    }
}
