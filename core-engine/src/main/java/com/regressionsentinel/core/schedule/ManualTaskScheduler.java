package com.regressionsentinel.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskScheduler} on virtual time.
 * <p>
 * Nothing runs until {@link #advanceBy(Duration)} is called; due tasks then
 * run in due-time order on the calling thread, with the clock set to each
 * task's due time while it runs. Tasks scheduled by a running task are
 * honoured within the same advance.
 * </p>
 */
public class ManualTaskScheduler implements TaskScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(ManualTaskScheduler.class);

    private final ManualClock clock;
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
            Comparator.comparing((Entry e) -> e.due).thenComparingLong(e -> e.sequence));
    private final Map<String, Entry> byKey = new HashMap<>();
    private long sequence;

    public ManualTaskScheduler(ManualClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ManualClock getClock() {
        return clock;
    }

    @Override
    public synchronized void schedule(String key, Duration delay, Runnable task) {
        add(key, delay, null, task);
    }

    @Override
    public synchronized void scheduleAtFixedRate(String key, Duration period, Runnable task) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        add(key, period, period, task);
    }

    private void add(String key, Duration delay, Duration period, Runnable task) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(task, "task must not be null");
        cancel(key);
        Entry entry = new Entry(key, clock.instant().plus(delay), period, task, sequence++);
        queue.add(entry);
        byKey.put(key, entry);
    }

    @Override
    public synchronized boolean cancel(String key) {
        Entry entry = byKey.remove(key);
        if (entry == null) {
            return false;
        }
        queue.remove(entry);
        return true;
    }

    @Override
    public synchronized boolean isScheduled(String key) {
        return byKey.containsKey(key);
    }

    @Override
    public synchronized void cancelAll() {
        queue.clear();
        byKey.clear();
    }

    /**
     * @return number of pending tasks
     */
    public synchronized int pendingCount() {
        return byKey.size();
    }

    /**
     * Move virtual time forward, running every task that falls due.
     *
     * @param duration how far to advance
     */
    public void advanceBy(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Entry next;
            synchronized (this) {
                next = queue.peek();
                if (next == null || next.due.isAfter(target)) {
                    break;
                }
                queue.poll();
                if (next.period != null) {
                    Entry again = new Entry(next.key, next.due.plus(next.period), next.period, next.task,
                            sequence++);
                    queue.add(again);
                    byKey.put(next.key, again);
                } else {
                    byKey.remove(next.key);
                }
            }
            if (next.due.isAfter(clock.instant())) {
                clock.setInstant(next.due);
            }
            try {
                next.task.run();
            } catch (RuntimeException e) {
                LOG.error("Scheduled task '{}' failed: {}", next.key, e.getMessage(), e);
            }
        }
        clock.setInstant(target);
    }

    @Override
    public void close() {
        cancelAll();
    }

    private static final class Entry {
        final String key;
        final Instant due;
        final Duration period;
        final Runnable task;
        final long sequence;

        Entry(String key, Instant due, Duration period, Runnable task, long sequence) {
            this.key = key;
            this.due = due;
            this.period = period;
            this.task = task;
            this.sequence = sequence;
        }
    }
}
