package com.regressionsentinel.framework.history;

import com.regressionsentinel.core.model.PerformanceMetrics;
import com.regressionsentinel.core.model.TimeRange;
import com.regressionsentinel.core.store.InMemorySnapshotStore;
import com.regressionsentinel.core.store.SnapshotStore;
import com.regressionsentinel.core.store.SnapshotStoreException;
import com.regressionsentinel.framework.model.PerformanceTestResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TestResultHistory}.
 */
class TestResultHistoryTest {

    private static final Instant START = Instant.parse("2024-03-01T09:00:00Z");

    private InMemorySnapshotStore<Map<String, List<PerformanceTestResult>>> store;

    @BeforeEach
    void setUp() {
        store = new InMemorySnapshotStore<>(TestResultHistory.SNAPSHOT_TYPE);
    }

    @Test
    @DisplayName("Should drop the oldest results beyond the per-test limit")
    void shouldCapPerTest() {
        TestResultHistory history = new TestResultHistory(store, 2);

        history.record(result("checkout", 0));
        history.record(result("checkout", 1));
        history.record(result("checkout", 2));
        history.record(result("search", 3));

        assertThat(history.forTest("checkout")).extracting(PerformanceTestResult::getTimestamp)
                .containsExactly(at(1), at(2));
        assertThat(history.testNames()).containsExactly("checkout", "search");
        assertThat(history.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should write through and reload from the store")
    void shouldReloadFromStore() {
        TestResultHistory history = new TestResultHistory(store, 10);
        history.record(result("checkout", 0));

        TestResultHistory reloaded = new TestResultHistory(store, 10);
        reloaded.load();

        assertThat(reloaded.forTest("checkout")).singleElement().satisfies(r -> {
            assertThat(r.getTimestamp()).isEqualTo(at(0));
            assertThat(r.getMetrics().getResponseTime().getMean()).isEqualTo(120.0);
        });
    }

    @Test
    @DisplayName("Should prune results at or before the cutoff")
    void shouldPruneOlderThanCutoff() {
        TestResultHistory history = new TestResultHistory(store, 10);
        history.record(result("checkout", 0));
        history.record(result("checkout", 1));
        history.record(result("search", 2));

        int removed = history.pruneOlderThan(at(1));

        assertThat(removed).isEqualTo(2);
        assertThat(history.all()).extracting(PerformanceTestResult::getTestName).containsExactly("search");
    }

    @Test
    @DisplayName("Should select results inside a closed range")
    void shouldSelectInRange() {
        TestResultHistory history = new TestResultHistory(store, 10);
        for (int minute = 0; minute < 5; minute++) {
            history.record(result("checkout", minute));
        }

        List<PerformanceTestResult> selected = history.inRange(new TimeRange(at(1), at(3)));

        assertThat(selected).extracting(PerformanceTestResult::getTimestamp).containsExactly(at(1), at(2), at(3));
    }

    @Test
    @DisplayName("Should keep in-memory results when the store fails")
    void shouldSurviveStoreFailure() {
        TestResultHistory history = new TestResultHistory(new FailingStore(), 10);

        history.load();
        history.record(result("checkout", 0));

        assertThat(history.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a non-positive limit")
    void shouldRejectInvalidLimit() {
        assertThatThrownBy(() -> new TestResultHistory(store, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maxPerTest must be >= 1, got: 0");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Instant at(int minute) {
        return START.plus(Duration.ofMinutes(minute));
    }

    private static PerformanceTestResult result(String testName, int minute) {
        return new PerformanceTestResult(testName, "load", at(minute), 250,
                PerformanceMetrics.of(120, 240, 850, 0.5, 40, 60), null, List.of(), List.of());
    }

    private static final class FailingStore implements SnapshotStore<Map<String, List<PerformanceTestResult>>> {
        @Override
        public Optional<Map<String, List<PerformanceTestResult>>> load() {
            throw new SnapshotStoreException("disk unavailable", null);
        }

        @Override
        public void save(Map<String, List<PerformanceTestResult>> snapshot) {
            throw new SnapshotStoreException("disk unavailable", null);
        }

        @Override
        public String describe() {
            return "failing";
        }
    }
}
