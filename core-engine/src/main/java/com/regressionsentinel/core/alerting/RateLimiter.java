package com.regressionsentinel.core.alerting;

import com.regressionsentinel.core.model.AlertSeverity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sliding-window limiter keyed by {@code <alertType>-<severity>}.
 * <p>
 * Each key keeps the admission times of the last 24 hours. An alert is
 * rejected when the key already admitted {@code maxPerHour} alerts in the
 * last hour or {@code maxPerDay} in the last day; rejected alerts do not
 * count against later ones.
 * </p>
 */
public class RateLimiter {

    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final int maxPerHour;
    private final int maxPerDay;
    private final Clock clock;
    private final Map<String, List<Instant>> admitted = new HashMap<>();

    public RateLimiter(int maxPerHour, int maxPerDay, Clock clock) {
        if (maxPerHour < 1 || maxPerDay < 1) {
            throw new IllegalArgumentException("Rate limits must be positive: perHour=" + maxPerHour
                    + ", perDay=" + maxPerDay);
        }
        this.maxPerHour = maxPerHour;
        this.maxPerDay = maxPerDay;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return {@code true} if the alert is admitted (and counted)
     */
    public synchronized boolean tryAcquire(String alertType, AlertSeverity severity) {
        Instant now = clock.instant();
        Instant dayAgo = now.minus(DAY);
        Instant hourAgo = now.minus(HOUR);

        List<Instant> timestamps = admitted.computeIfAbsent(key(alertType, severity), k -> new ArrayList<>());
        timestamps.removeIf(ts -> !ts.isAfter(dayAgo));

        long hourly = timestamps.stream().filter(ts -> ts.isAfter(hourAgo)).count();
        if (hourly >= maxPerHour || timestamps.size() >= maxPerDay) {
            return false;
        }
        timestamps.add(now);
        return true;
    }

    synchronized int admittedCount(String alertType, AlertSeverity severity) {
        List<Instant> timestamps = admitted.get(key(alertType, severity));
        return timestamps != null ? timestamps.size() : 0;
    }

    public synchronized void reset() {
        admitted.clear();
    }

    static String key(String alertType, AlertSeverity severity) {
        return alertType + "-" + severity.label();
    }
}
