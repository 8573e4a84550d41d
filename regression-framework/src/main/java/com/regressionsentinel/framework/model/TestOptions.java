package com.regressionsentinel.framework.model;

import com.regressionsentinel.framework.collaborator.RunMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-run options of {@code runPerformanceTest}.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} or the {@link Builder}.
 * </p>
 */
public final class TestOptions {

    private static final TestOptions DEFAULTS = new Builder().build();

    private final boolean visualTest;
    private final boolean skipBaseline;
    private final String version;
    private final List<String> tags;

    private TestOptions(Builder b) {
        this.visualTest = b.visualTest;
        this.skipBaseline = b.skipBaseline;
        this.version = b.version;
        this.tags = List.copyOf(b.tags);
    }

    public static TestOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isVisualTest() {
        return visualTest;
    }

    public boolean isSkipBaseline() {
        return skipBaseline;
    }

    public String getVersion() {
        return version;
    }

    public List<String> getTags() {
        return tags;
    }

    public RunMetadata toRunMetadata() {
        return new RunMetadata(version, tags);
    }

    public static class Builder {
        private boolean visualTest;
        private boolean skipBaseline;
        private String version;
        private final List<String> tags = new ArrayList<>();

        public Builder visualTest(boolean v) {
            this.visualTest = v;
            return this;
        }

        public Builder skipBaseline(boolean v) {
            this.skipBaseline = v;
            return this;
        }

        public Builder version(String v) {
            this.version = v;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags.clear();
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public TestOptions build() {
            return new TestOptions(this);
        }
    }

    @Override
    public String toString() {
        return "TestOptions{visualTest=" + visualTest + ", skipBaseline=" + skipBaseline
                + ", version='" + version + "', tags=" + tags + '}';
    }
}
