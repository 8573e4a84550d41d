package com.regressionsentinel.core.statistics;

import java.util.Locale;

/**
 * Anomaly sensitivity levels and their z-score thresholds. Higher
 * sensitivity means a lower threshold.
 */
public enum AnomalySensitivity {
    LOW(3.0),
    MEDIUM(2.5),
    HIGH(2.0);

    private final double threshold;

    AnomalySensitivity(double threshold) {
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    /**
     * @param value {@code low}, {@code medium} or {@code high}, any case
     * @return the matching sensitivity
     * @throws IllegalArgumentException if the value is unknown
     */
    public static AnomalySensitivity fromString(String value) {
        if (value != null) {
            for (AnomalySensitivity sensitivity : values()) {
                if (sensitivity.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return sensitivity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown anomaly sensitivity: '" + value
                + "'. Supported: low, medium, high");
    }
}
