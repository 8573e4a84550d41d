package com.regressionsentinel.framework.collaborator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.regressionsentinel.core.model.PerformanceMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A baseline as returned by the external {@link BaselineRecorder}. The
 * framework only forwards it in events and exports.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineRecord {

    private String id;
    private String testType;
    private String testName;
    private Instant timestamp;
    private String version;
    private List<String> tags = new ArrayList<>();
    private PerformanceMetrics metrics;

    /** No-arg constructor required by Jackson. */
    public BaselineRecord() {
    }

    public BaselineRecord(String id, String testType, String testName, Instant timestamp,
            PerformanceMetrics metrics) {
        this.id = id;
        this.testType = testType;
        this.testName = testName;
        this.timestamp = timestamp;
        this.metrics = metrics;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTestType() {
        return testType;
    }

    public void setTestType(String testType) {
        this.testType = testType;
    }

    public String getTestName() {
        return testName;
    }

    public void setTestName(String testName) {
        this.testName = testName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public PerformanceMetrics getMetrics() {
        return metrics;
    }

    public void setMetrics(PerformanceMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public String toString() {
        return "BaselineRecord{id='" + id + "', testType='" + testType + "', testName='" + testName
                + "', timestamp=" + timestamp + '}';
    }
}
