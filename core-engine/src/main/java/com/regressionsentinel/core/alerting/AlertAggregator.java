package com.regressionsentinel.core.alerting;

import com.regressionsentinel.core.model.Alert;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregation buffers keyed by {@code <testType>-<testName>}.
 * <p>
 * Every alert for a key is held back, the first one included. The engine
 * drains a buffer when it reaches {@code maxAlerts}, when its timer fires or
 * when the periodic sweep finds it stale.
 * </p>
 * <p>Not thread-safe; owned by the alerting engine.</p>
 */
class AlertAggregator {

    private final Duration window;
    private final int maxAlerts;
    private final Clock clock;
    private final Map<String, List<Alert>> buffers = new LinkedHashMap<>();

    AlertAggregator(Duration window, int maxAlerts, Clock clock) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.maxAlerts = maxAlerts;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    static String keyOf(Alert alert) {
        return alert.getTestType() + "-" + alert.getTestName();
    }

    /**
     * @return the buffer size after adding
     */
    int add(Alert alert) {
        List<Alert> buffer = buffers.computeIfAbsent(keyOf(alert), k -> new ArrayList<>());
        buffer.add(alert);
        return buffer.size();
    }

    boolean isFull(String key) {
        List<Alert> buffer = buffers.get(key);
        return buffer != null && buffer.size() >= maxAlerts;
    }

    /**
     * @return {@code true} if the oldest alert in the buffer is older than
     *         the window
     */
    boolean isStale(String key) {
        List<Alert> buffer = buffers.get(key);
        if (buffer == null || buffer.isEmpty()) {
            return false;
        }
        Instant oldest = buffer.stream()
                .map(Alert::getTimestamp)
                .min(Comparator.naturalOrder())
                .orElseThrow();
        return oldest.isBefore(clock.instant().minus(window));
    }

    List<String> staleKeys() {
        return buffers.keySet().stream().filter(this::isStale).toList();
    }

    /**
     * Remove and return the buffer for {@code key}.
     */
    List<Alert> drain(String key) {
        List<Alert> buffer = buffers.remove(key);
        return buffer != null ? buffer : List.of();
    }

    int size(String key) {
        List<Alert> buffer = buffers.get(key);
        return buffer != null ? buffer.size() : 0;
    }

    List<String> keys() {
        return List.copyOf(buffers.keySet());
    }

    void clear() {
        buffers.clear();
    }
}
