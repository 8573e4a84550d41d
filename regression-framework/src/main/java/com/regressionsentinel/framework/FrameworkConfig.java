package com.regressionsentinel.framework;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Typed, immutable runtime configuration of the regression framework.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the process is configurable from a container definition or a shell without
 * touching {@code sentinel.yml}, which holds the analysis and alerting
 * settings.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class FrameworkConfig {

    public static final String ENV_DATA_DIR = "SENTINEL_DATA_DIR";
    public static final String ENV_HEALTH_PORT = "HEALTH_PORT";

    // ---------------------------------------------------------------
    // Storage
    // ---------------------------------------------------------------
    private final String dataDirectory;
    private final int retentionDays;
    private final int maxResultsPerTest;

    // ---------------------------------------------------------------
    // Background jobs
    // ---------------------------------------------------------------
    private final long maintenanceIntervalMinutes;
    private final long automatedTestIntervalMinutes;
    private final boolean automatedTestingEnabled;

    // ---------------------------------------------------------------
    // Features
    // ---------------------------------------------------------------
    private final boolean visualRegressionEnabled;
    private final boolean alertOnAnomalies;
    private final int reportLookbackDays;

    // ---------------------------------------------------------------
    // Health / Environment
    // ---------------------------------------------------------------
    private final int healthPort;
    private final String environment;

    private FrameworkConfig(Builder b) {
        this.dataDirectory = b.dataDirectory;
        this.retentionDays = b.retentionDays;
        this.maxResultsPerTest = b.maxResultsPerTest;
        this.maintenanceIntervalMinutes = b.maintenanceIntervalMinutes;
        this.automatedTestIntervalMinutes = b.automatedTestIntervalMinutes;
        this.automatedTestingEnabled = b.automatedTestingEnabled;
        this.visualRegressionEnabled = b.visualRegressionEnabled;
        this.alertOnAnomalies = b.alertOnAnomalies;
        this.reportLookbackDays = b.reportLookbackDays;
        this.healthPort = b.healthPort;
        this.environment = b.environment;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link FrameworkConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static FrameworkConfig fromEnvironment() {
        try {
            return new Builder()
                    .dataDirectory(env(ENV_DATA_DIR, "performance-data"))
                    .retentionDays(parseIntEnv("SENTINEL_RETENTION_DAYS", "90"))
                    .maxResultsPerTest(parseIntEnv("SENTINEL_MAX_RESULTS_PER_TEST", "100"))
                    .maintenanceIntervalMinutes(parseLongEnv("SENTINEL_MAINTENANCE_INTERVAL_MINUTES", "360"))
                    .automatedTestIntervalMinutes(parseLongEnv("SENTINEL_AUTOMATED_TEST_INTERVAL_MINUTES", "240"))
                    .automatedTestingEnabled(parseBooleanEnv("SENTINEL_AUTOMATED_TESTING", "false"))
                    .visualRegressionEnabled(parseBooleanEnv("SENTINEL_VISUAL_REGRESSION", "true"))
                    .alertOnAnomalies(parseBooleanEnv("SENTINEL_ALERT_ON_ANOMALIES", "true"))
                    .reportLookbackDays(parseIntEnv("SENTINEL_REPORT_LOOKBACK_DAYS", "7"))
                    .healthPort(parseIntEnv(ENV_HEALTH_PORT, "8080"))
                    .environment(env("SENTINEL_ENVIRONMENT", "development"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public Path dataPath() {
        return Path.of(dataDirectory);
    }

    public Duration retention() {
        return Duration.ofDays(retentionDays);
    }

    public Duration maintenanceInterval() {
        return Duration.ofMinutes(maintenanceIntervalMinutes);
    }

    public Duration automatedTestInterval() {
        return Duration.ofMinutes(automatedTestIntervalMinutes);
    }

    public Duration reportLookback() {
        return Duration.ofDays(reportLookbackDays);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDataDirectory() {
        return dataDirectory;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public int getMaxResultsPerTest() {
        return maxResultsPerTest;
    }

    public long getMaintenanceIntervalMinutes() {
        return maintenanceIntervalMinutes;
    }

    public long getAutomatedTestIntervalMinutes() {
        return automatedTestIntervalMinutes;
    }

    public boolean isAutomatedTestingEnabled() {
        return automatedTestingEnabled;
    }

    public boolean isVisualRegressionEnabled() {
        return visualRegressionEnabled;
    }

    public boolean isAlertOnAnomalies() {
        return alertOnAnomalies;
    }

    public int getReportLookbackDays() {
        return reportLookbackDays;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public String getEnvironment() {
        return environment;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link FrameworkConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (positive retention, history size and intervals, port in
     * [1, 65535], non-blank directory and environment).
     * </p>
     */
    public static class Builder {
        private String dataDirectory = "performance-data";
        private int retentionDays = 90;
        private int maxResultsPerTest = 100;
        private long maintenanceIntervalMinutes = 360;
        private long automatedTestIntervalMinutes = 240;
        private boolean automatedTestingEnabled = false;
        private boolean visualRegressionEnabled = true;
        private boolean alertOnAnomalies = true;
        private int reportLookbackDays = 7;
        private int healthPort = 8080;
        private String environment = "development";

        public Builder dataDirectory(String v) {
            this.dataDirectory = v;
            return this;
        }

        public Builder retentionDays(int v) {
            this.retentionDays = v;
            return this;
        }

        public Builder maxResultsPerTest(int v) {
            this.maxResultsPerTest = v;
            return this;
        }

        public Builder maintenanceIntervalMinutes(long v) {
            this.maintenanceIntervalMinutes = v;
            return this;
        }

        public Builder automatedTestIntervalMinutes(long v) {
            this.automatedTestIntervalMinutes = v;
            return this;
        }

        public Builder automatedTestingEnabled(boolean v) {
            this.automatedTestingEnabled = v;
            return this;
        }

        public Builder visualRegressionEnabled(boolean v) {
            this.visualRegressionEnabled = v;
            return this;
        }

        public Builder alertOnAnomalies(boolean v) {
            this.alertOnAnomalies = v;
            return this;
        }

        public Builder reportLookbackDays(int v) {
            this.reportLookbackDays = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder environment(String v) {
            this.environment = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link FrameworkConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public FrameworkConfig build() {
            requireNonBlank(dataDirectory, "dataDirectory");
            requireNonBlank(environment, "environment");

            if (retentionDays < 1) {
                throw new IllegalArgumentException("retentionDays must be >= 1, got: " + retentionDays);
            }
            if (maxResultsPerTest < 1) {
                throw new IllegalArgumentException(
                        "maxResultsPerTest must be >= 1, got: " + maxResultsPerTest);
            }
            if (maintenanceIntervalMinutes < 1) {
                throw new IllegalArgumentException(
                        "maintenanceIntervalMinutes must be >= 1, got: " + maintenanceIntervalMinutes);
            }
            if (automatedTestIntervalMinutes < 1) {
                throw new IllegalArgumentException(
                        "automatedTestIntervalMinutes must be >= 1, got: " + automatedTestIntervalMinutes);
            }
            if (reportLookbackDays < 1) {
                throw new IllegalArgumentException(
                        "reportLookbackDays must be >= 1, got: " + reportLookbackDays);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new FrameworkConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    private static boolean parseBooleanEnv(String name, String defaultValue) {
        return Boolean.parseBoolean(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "FrameworkConfig{" +
                "dataDirectory='" + dataDirectory + '\'' +
                ", retentionDays=" + retentionDays +
                ", maxResultsPerTest=" + maxResultsPerTest +
                ", maintenanceIntervalMinutes=" + maintenanceIntervalMinutes +
                ", automatedTestIntervalMinutes=" + automatedTestIntervalMinutes +
                ", automatedTestingEnabled=" + automatedTestingEnabled +
                ", visualRegressionEnabled=" + visualRegressionEnabled +
                ", alertOnAnomalies=" + alertOnAnomalies +
                ", healthPort=" + healthPort +
                ", environment='" + environment + '\'' +
                '}';
    }
}
