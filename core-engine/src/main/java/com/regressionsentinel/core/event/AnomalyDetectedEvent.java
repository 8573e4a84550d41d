package com.regressionsentinel.core.event;

import com.regressionsentinel.core.model.MetricSample;
import com.regressionsentinel.core.statistics.AnomalyDetection;

import java.time.Instant;
import java.util.List;

/**
 * Anomalies found either on a newly ingested sample ({@code testName} and
 * {@code sample} set) or by a scheduled analysis (both {@code null}).
 */
public class AnomalyDetectedEvent extends SentinelEvent {

    private final String testName;
    private final List<AnomalyDetection> anomalies;
    private final MetricSample sample;

    public AnomalyDetectedEvent(Instant timestamp, String testName, List<AnomalyDetection> anomalies,
            MetricSample sample) {
        super(timestamp);
        this.testName = testName;
        this.anomalies = List.copyOf(anomalies);
        this.sample = sample;
    }

    public String getTestName() {
        return testName;
    }

    public List<AnomalyDetection> getAnomalies() {
        return anomalies;
    }

    public int getCount() {
        return anomalies.size();
    }

    public MetricSample getSample() {
        return sample;
    }

    @Override
    public String topic() {
        return "anomalyDetected";
    }
}
