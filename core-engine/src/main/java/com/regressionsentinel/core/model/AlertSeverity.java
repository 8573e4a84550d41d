package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a regression alert, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum AlertSeverity {
    MINOR("minor", "#388e3c"),
    MODERATE("moderate", "#fbc02d"),
    MAJOR("major", "#f57c00"),
    CRITICAL("critical", "#d32f2f");

    private final String label;
    private final String color;

    AlertSeverity(String label, String color) {
        this.label = label;
        this.color = color;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * @return hex colour used by chat-ops attachments
     */
    public String color() {
        return color;
    }

    /**
     * Parse a severity name, ignoring case.
     *
     * @param value severity name such as {@code "major"}
     * @return the matching severity
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static AlertSeverity fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AlertSeverity severity : values()) {
                if (severity.label.equals(normalized)) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown alert severity: '" + value
                + "'. Supported: minor, moderate, major, critical");
    }

    /**
     * Map a visual regression score (0-100, higher is better) to a severity.
     *
     * @param overallScore visual similarity score
     * @return {@code critical} at 30 or below, {@code major} at 50 or below,
     *         {@code moderate} at 70 or below, otherwise {@code minor}
     */
    public static AlertSeverity fromVisualScore(double overallScore) {
        if (overallScore <= 30) {
            return CRITICAL;
        }
        if (overallScore <= 50) {
            return MAJOR;
        }
        if (overallScore <= 70) {
            return MODERATE;
        }
        return MINOR;
    }
}
