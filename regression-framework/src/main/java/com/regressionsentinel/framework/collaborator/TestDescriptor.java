package com.regressionsentinel.framework.collaborator;

import java.util.Objects;

/**
 * Describes the run a baseline is recorded for.
 */
public final class TestDescriptor {

    private final String name;
    private final String description;
    private final long durationMs;

    public TestDescriptor(String name, String description, long durationMs) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.description = description;
        this.durationMs = durationMs;
    }

    /**
     * Descriptor with the standard description {@code "Performance test: <name>"}.
     */
    public static TestDescriptor of(String name, long durationMs) {
        return new TestDescriptor(name, "Performance test: " + name, durationMs);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TestDescriptor that))
            return false;
        return durationMs == that.durationMs && name.equals(that.name)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, durationMs);
    }

    @Override
    public String toString() {
        return "TestDescriptor{name='" + name + "', durationMs=" + durationMs + '}';
    }
}
