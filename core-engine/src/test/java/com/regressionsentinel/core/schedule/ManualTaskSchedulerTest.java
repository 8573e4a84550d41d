package com.regressionsentinel.core.schedule;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ManualTaskScheduler}.
 */
class ManualTaskSchedulerTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private ManualClock clock;
    private ManualTaskScheduler scheduler;
    private List<String> log;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(START);
        scheduler = new ManualTaskScheduler(clock);
        log = new ArrayList<>();
    }

    @Test
    @DisplayName("Should run one-shot tasks in due order with the clock at their due time")
    void shouldRunDueTasksInOrder() {
        scheduler.schedule("b", Duration.ofMinutes(20), () -> log.add("b@" + clock.instant()));
        scheduler.schedule("a", Duration.ofMinutes(10), () -> log.add("a@" + clock.instant()));
        scheduler.schedule("c", Duration.ofHours(2), () -> log.add("c"));

        scheduler.advanceBy(Duration.ofHours(1));

        assertThat(log).containsExactly("a@2024-03-01T00:10:00Z", "b@2024-03-01T00:20:00Z");
        assertThat(clock.instant()).isEqualTo(START.plus(Duration.ofHours(1)));
        assertThat(scheduler.isScheduled("c")).isTrue();
        assertThat(scheduler.pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should repeat fixed-rate tasks once per period")
    void shouldRepeatFixedRateTasks() {
        scheduler.scheduleAtFixedRate("tick", Duration.ofMinutes(15), () -> log.add("tick"));

        scheduler.advanceBy(Duration.ofHours(1));

        assertThat(log).hasSize(4);
        assertThat(scheduler.isScheduled("tick")).isTrue();
    }

    @Test
    @DisplayName("Should replace a task scheduled under the same key")
    void shouldReplaceTaskWithSameKey() {
        scheduler.schedule("k", Duration.ofMinutes(5), () -> log.add("first"));
        scheduler.schedule("k", Duration.ofMinutes(10), () -> log.add("second"));

        scheduler.advanceBy(Duration.ofMinutes(30));

        assertThat(log).containsExactly("second");
    }

    @Test
    @DisplayName("Should honour tasks scheduled by a running task within the same advance")
    void shouldRunTasksScheduledByTasks() {
        scheduler.schedule("outer", Duration.ofMinutes(10), () -> {
            log.add("outer");
            scheduler.schedule("inner", Duration.ofMinutes(10), () -> log.add("inner@" + clock.instant()));
        });

        scheduler.advanceBy(Duration.ofMinutes(25));

        assertThat(log).containsExactly("outer", "inner@2024-03-01T00:20:00Z");
    }

    @Test
    @DisplayName("Should not run cancelled tasks and keep going after a failing task")
    void shouldCancelAndSurviveFailures() {
        scheduler.schedule("cancelled", Duration.ofMinutes(1), () -> log.add("cancelled"));
        scheduler.schedule("boom", Duration.ofMinutes(2), () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.schedule("after", Duration.ofMinutes(3), () -> log.add("after"));

        assertThat(scheduler.cancel("cancelled")).isTrue();
        assertThat(scheduler.cancel("cancelled")).isFalse();
        scheduler.advanceBy(Duration.ofMinutes(5));

        assertThat(log).containsExactly("after");
    }

    @Test
    @DisplayName("Should drop everything on close")
    void shouldCancelAllOnClose() {
        scheduler.schedule("a", Duration.ofMinutes(1), () -> log.add("a"));
        scheduler.scheduleAtFixedRate("b", Duration.ofMinutes(1), () -> log.add("b"));

        scheduler.close();
        scheduler.advanceBy(Duration.ofMinutes(10));

        assertThat(log).isEmpty();
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive period")
    void shouldRejectZeroPeriod() {
        assertThatThrownBy(() -> scheduler.scheduleAtFixedRate("x", Duration.ZERO, () -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
