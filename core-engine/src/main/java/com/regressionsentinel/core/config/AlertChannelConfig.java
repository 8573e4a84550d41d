package com.regressionsentinel.core.config;

import com.regressionsentinel.core.model.AlertSeverity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One delivery channel from the {@code alerting.channels} list.
 *
 * <pre>
 * - name: ops-slack
 *   type: chatops
 *   enabled: true
 *   severityFilter: [major, critical]
 *   config:
 *     webhookUrl: https://hooks.example.com/T000/B000
 *     channel: "#perf-alerts"
 * </pre>
 *
 * <p>
 * Required {@code config} keys depend on the type: {@code file} needs
 * {@code logFile}, {@code webhook} needs {@code url}, {@code chatops} needs
 * {@code webhookUrl} and {@code channel}, {@code email} needs
 * {@code recipients}. {@code console} needs nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertChannelConfig {

    private String name;

    /** console, file, webhook, chatops (alias slack) or email. */
    private String type;

    private boolean enabled = true;

    /** Severities delivered through this channel; empty means none. */
    private List<String> severityFilter = new ArrayList<>(List.of("minor", "moderate", "major", "critical"));

    /** Type-specific settings. */
    private Map<String, Object> config = new LinkedHashMap<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if the channel is misconfigured
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Channel 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Channel '" + name + "' requires 'type'");
        } else {
            switch (type.toLowerCase(Locale.ROOT)) {
                case "console" -> {
                    // no settings
                }
                case "file" -> requireKey(errors, "logFile");
                case "webhook" -> requireKey(errors, "url");
                case "chatops", "slack" -> {
                    requireKey(errors, "webhookUrl");
                    requireKey(errors, "channel");
                }
                case "email" -> {
                    if (getStringList("recipients").isEmpty()) {
                        errors.add("Email channel '" + name + "' requires non-empty 'recipients'");
                    }
                }
                default -> errors.add("Channel '" + name + "' has unknown type '" + type
                        + "'. Supported: console, file, webhook, chatops, email");
            }
        }
        for (String severity : severityFilter) {
            try {
                AlertSeverity.fromString(severity);
            } catch (IllegalArgumentException e) {
                errors.add("Channel '" + name + "' severityFilter: " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    private void requireKey(List<String> errors, String key) {
        Object value = config.get(key);
        if (value == null || value.toString().isBlank()) {
            errors.add("Channel '" + name + "' of type '" + type + "' requires config '" + key + "'");
        }
    }

    /**
     * @param severity alert severity
     * @return {@code true} if {@code severityFilter} lists it
     */
    public boolean acceptsSeverity(AlertSeverity severity) {
        for (String entry : severityFilter) {
            if (entry != null && entry.trim().equalsIgnoreCase(severity.label())) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the config value as a string, or {@code null}
     */
    public String getString(String key) {
        Object value = config.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Read a list setting; a single comma-separated string is accepted too.
     */
    public List<String> getStringList(String key) {
        Object value = config.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        } else if (value != null) {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getSeverityFilter() {
        return Collections.unmodifiableList(severityFilter);
    }

    public void setSeverityFilter(List<String> severityFilter) {
        this.severityFilter = severityFilter != null ? new ArrayList<>(severityFilter) : new ArrayList<>();
    }

    public Map<String, Object> getConfig() {
        return Collections.unmodifiableMap(config);
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "AlertChannelConfig{name='" + name + "', type='" + type + "', enabled=" + enabled
                + ", severityFilter=" + severityFilter + '}';
    }
}
