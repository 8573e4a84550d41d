package com.regressionsentinel.framework.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.regressionsentinel.core.model.TimeRange;
import com.regressionsentinel.core.store.SnapshotStore;
import com.regressionsentinel.core.store.SnapshotStoreException;
import com.regressionsentinel.framework.model.PerformanceTestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recent test results per test name, written through to a
 * {@link SnapshotStore} after every change.
 *
 * <p>
 * Each test keeps at most {@code maxPerTest} results; recording beyond that
 * drops the oldest. A failed write is logged and the in-memory history stays
 * authoritative.
 * </p>
 */
public class TestResultHistory {

    private static final Logger LOG = LoggerFactory.getLogger(TestResultHistory.class);

    public static final TypeReference<Map<String, List<PerformanceTestResult>>> SNAPSHOT_TYPE =
            new TypeReference<>() {
            };

    private final SnapshotStore<Map<String, List<PerformanceTestResult>>> store;
    private final int maxPerTest;
    private Map<String, List<PerformanceTestResult>> results = new LinkedHashMap<>();

    public TestResultHistory(SnapshotStore<Map<String, List<PerformanceTestResult>>> store, int maxPerTest) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        if (maxPerTest < 1) {
            throw new IllegalArgumentException("maxPerTest must be >= 1, got: " + maxPerTest);
        }
        this.maxPerTest = maxPerTest;
    }

    /**
     * Replace the in-memory history with the stored snapshot, if any.
     */
    public synchronized void load() {
        try {
            store.load().ifPresent(snapshot -> {
                Map<String, List<PerformanceTestResult>> loaded = new LinkedHashMap<>();
                snapshot.forEach((name, list) -> loaded.put(name, new ArrayList<>(list)));
                results = loaded;
                LOG.info("Loaded {} test result(s) for {} test(s) from {}", size(), results.size(),
                        store.describe());
            });
        } catch (SnapshotStoreException e) {
            LOG.warn("Failed to load test results from {}, starting empty: {}", store.describe(),
                    e.getMessage(), e);
        }
    }

    public synchronized void record(PerformanceTestResult result) {
        Objects.requireNonNull(result, "result must not be null");
        List<PerformanceTestResult> list = results.computeIfAbsent(result.getTestName(), k -> new ArrayList<>());
        list.add(result);
        if (list.size() > maxPerTest) {
            list.subList(0, list.size() - maxPerTest).clear();
        }
        persist();
    }

    /**
     * Drop every result taken at or before the cutoff.
     *
     * @return number of results removed
     */
    public synchronized int pruneOlderThan(Instant cutoff) {
        int removed = 0;
        for (List<PerformanceTestResult> list : results.values()) {
            int before = list.size();
            list.removeIf(r -> !r.getTimestamp().isAfter(cutoff));
            removed += before - list.size();
        }
        persist();
        return removed;
    }

    /**
     * @return results whose timestamp lies in the range, grouped by test in
     *         first-seen order
     */
    public synchronized List<PerformanceTestResult> inRange(TimeRange range) {
        Objects.requireNonNull(range, "range must not be null");
        return results.values().stream()
                .flatMap(List::stream)
                .filter(r -> range.contains(r.getTimestamp()))
                .toList();
    }

    public synchronized List<PerformanceTestResult> all() {
        return results.values().stream().flatMap(List::stream).toList();
    }

    public synchronized List<PerformanceTestResult> forTest(String testName) {
        return List.copyOf(results.getOrDefault(testName, List.of()));
    }

    public synchronized List<String> testNames() {
        return List.copyOf(results.keySet());
    }

    public synchronized int size() {
        return results.values().stream().mapToInt(List::size).sum();
    }

    public synchronized void persist() {
        try {
            store.save(results);
        } catch (SnapshotStoreException e) {
            LOG.warn("Failed to persist test results to {}, keeping in-memory state: {}", store.describe(),
                    e.getMessage(), e);
        }
    }
}
