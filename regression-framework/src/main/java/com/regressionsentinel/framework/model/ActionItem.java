package com.regressionsentinel.framework.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * A prioritized follow-up listed in a {@link PerformanceReport}.
 */
public final class ActionItem {

    public enum Priority {
        LOW, MEDIUM, HIGH, CRITICAL;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Priority fromString(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum Effort {
        LOW, MEDIUM, HIGH;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Effort fromString(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Priority priority;
    private final String action;
    private final String impact;
    private final Effort effort;

    @JsonCreator
    public ActionItem(@JsonProperty("priority") Priority priority,
            @JsonProperty("action") String action,
            @JsonProperty("impact") String impact,
            @JsonProperty("effort") Effort effort) {
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.impact = impact;
        this.effort = Objects.requireNonNull(effort, "effort must not be null");
    }

    public Priority getPriority() {
        return priority;
    }

    public String getAction() {
        return action;
    }

    public String getImpact() {
        return impact;
    }

    public Effort getEffort() {
        return effort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ActionItem that))
            return false;
        return priority == that.priority && effort == that.effort && action.equals(that.action)
                && Objects.equals(impact, that.impact);
    }

    @Override
    public int hashCode() {
        return Objects.hash(priority, action, impact, effort);
    }

    @Override
    public String toString() {
        return "ActionItem{" + priority.label() + ": " + action + '}';
    }
}
