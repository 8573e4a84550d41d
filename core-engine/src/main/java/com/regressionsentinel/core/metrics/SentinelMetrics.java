package com.regressionsentinel.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Metric definitions for Regression Sentinel.
 * <p>
 * The registry decides where the meters are exported; by default they live
 * in an in-process {@link SimpleMeterRegistry}.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code sentinel.samples.ingested} – samples accepted by the statistical engine</li>
 * <li>{@code sentinel.anomalies.detected} – anomalies on newly ingested samples</li>
 * <li>{@code sentinel.alerts.delivered} – successful channel deliveries</li>
 * <li>{@code sentinel.alerts.delivery.failures} – failed channel deliveries</li>
 * <li>{@code sentinel.alerts.rate_limited} – alerts dropped by the rate limiter</li>
 * <li>{@code sentinel.alerts.aggregated} – aggregated alerts flushed</li>
 * <li>{@code sentinel.alerts.escalated} – escalations sent</li>
 * <li>{@code sentinel.alerts.delivery.latency} – time from alert creation to first delivery</li>
 * </ul>
 */
public class SentinelMetrics {

    private final MeterRegistry registry;
    private final Counter samplesIngested;
    private final Counter anomaliesDetected;
    private final Counter alertsDelivered;
    private final Counter deliveryFailures;
    private final Counter alertsRateLimited;
    private final Counter alertsAggregated;
    private final Counter alertsEscalated;
    private final Timer deliveryLatency;

    public SentinelMetrics() {
        this(new SimpleMeterRegistry());
    }

    public SentinelMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.samplesIngested = registry.counter("sentinel.samples.ingested");
        this.anomaliesDetected = registry.counter("sentinel.anomalies.detected");
        this.alertsDelivered = registry.counter("sentinel.alerts.delivered");
        this.deliveryFailures = registry.counter("sentinel.alerts.delivery.failures");
        this.alertsRateLimited = registry.counter("sentinel.alerts.rate_limited");
        this.alertsAggregated = registry.counter("sentinel.alerts.aggregated");
        this.alertsEscalated = registry.counter("sentinel.alerts.escalated");
        this.deliveryLatency = Timer.builder("sentinel.alerts.delivery.latency")
                .description("Time spent on one successful channel delivery")
                .register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void incrementSamplesIngested() {
        samplesIngested.increment();
    }

    public void incrementAnomaliesDetected(int count) {
        anomaliesDetected.increment(count);
    }

    public void incrementAlertsDelivered() {
        alertsDelivered.increment();
    }

    public void incrementDeliveryFailures() {
        deliveryFailures.increment();
    }

    public void incrementRateLimited() {
        alertsRateLimited.increment();
    }

    public void incrementAggregated() {
        alertsAggregated.increment();
    }

    public void incrementEscalated() {
        alertsEscalated.increment();
    }

    public void recordDeliveryLatency(Duration latency) {
        if (!latency.isNegative()) {
            deliveryLatency.record(latency);
        }
    }
}
