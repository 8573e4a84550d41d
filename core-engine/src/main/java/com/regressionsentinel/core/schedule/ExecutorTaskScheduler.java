package com.regressionsentinel.core.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} on a single daemon thread.
 * <p>
 * All tasks run on the same thread, so timers never race each other. A task
 * that throws is logged and, for periodic tasks, runs again at its next
 * period.
 * </p>
 */
public class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledFuture<?>> tasks = new HashMap<>();

    public ExecutorTaskScheduler() {
        this("regression-sentinel-scheduler");
    }

    public ExecutorTaskScheduler(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public synchronized void schedule(String key, Duration delay, Runnable task) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(task, "task must not be null");
        cancel(key);
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        self[0] = executor.schedule(() -> {
            synchronized (this) {
                // Only drop the mapping if it still points at this run
                if (tasks.get(key) == self[0]) {
                    tasks.remove(key);
                }
            }
            runSafely(key, task);
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        tasks.put(key, self[0]);
        LOG.debug("Scheduled '{}' in {}", key, delay);
    }

    @Override
    public synchronized void scheduleAtFixedRate(String key, Duration period, Runnable task) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(task, "task must not be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        cancel(key);
        long millis = period.toMillis();
        tasks.put(key, executor.scheduleAtFixedRate(() -> runSafely(key, task),
                millis, millis, TimeUnit.MILLISECONDS));
        LOG.debug("Scheduled '{}' every {}", key, period);
    }

    @Override
    public synchronized boolean cancel(String key) {
        ScheduledFuture<?> future = tasks.remove(key);
        if (future == null) {
            return false;
        }
        return future.cancel(false);
    }

    @Override
    public synchronized boolean isScheduled(String key) {
        ScheduledFuture<?> future = tasks.get(key);
        return future != null && !future.isDone();
    }

    @Override
    public synchronized void cancelAll() {
        tasks.values().forEach(f -> f.cancel(false));
        tasks.clear();
    }

    @Override
    public void close() {
        cancelAll();
        executor.shutdownNow();
        LOG.info("Task scheduler stopped");
    }

    private static void runSafely(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Scheduled task '{}' failed: {}", key, e.getMessage(), e);
        }
    }
}
