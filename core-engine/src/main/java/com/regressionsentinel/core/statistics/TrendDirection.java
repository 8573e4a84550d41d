package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    IMPROVING,
    STABLE,
    DEGRADING;

    /**
     * Classify a score where positive means better.
     *
     * @param score     signed score
     * @param threshold band around zero treated as stable
     * @return the direction of {@code score}
     */
    public static TrendDirection of(double score, double threshold) {
        if (score > threshold) {
            return IMPROVING;
        }
        if (score < -threshold) {
            return DEGRADING;
        }
        return STABLE;
    }

    /**
     * @return {@code 1} for improving, {@code -1} for degrading, else {@code 0}
     */
    public int sign() {
        return switch (this) {
            case IMPROVING -> 1;
            case DEGRADING -> -1;
            case STABLE -> 0;
        };
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TrendDirection fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
