package com.regressionsentinel.framework.collaborator;

import java.util.List;
import java.util.Objects;

/**
 * Version and tags of a test run, passed to the baseline collaborators.
 */
public final class RunMetadata {

    private final String version;
    private final List<String> tags;

    public RunMetadata(String version, List<String> tags) {
        this.version = version;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /** @return the build version, or {@code null} if unknown */
    public String getVersion() {
        return version;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RunMetadata that))
            return false;
        return Objects.equals(version, that.version) && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, tags);
    }

    @Override
    public String toString() {
        return "RunMetadata{version='" + version + "', tags=" + tags + '}';
    }
}
