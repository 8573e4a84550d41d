package com.regressionsentinel.framework.model;

import java.util.Locale;

/**
 * Output format of a performance data export.
 */
public enum ExportFormat {
    JSON,
    CSV;

    /**
     * @throws IllegalArgumentException if the value names no known format
     */
    public static ExportFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Export format must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: '" + value + "'", e);
        }
    }
}
