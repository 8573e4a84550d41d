package com.regressionsentinel.core.schedule;

import java.time.Duration;

/**
 * Keyed, cancellable timers.
 * <p>
 * Every task is registered under a key such as {@code escalation:<alertId>}.
 * Scheduling a key that is already scheduled replaces the previous task, and
 * {@link #close()} cancels everything that is still pending.
 * </p>
 */
public interface TaskScheduler extends AutoCloseable {

    /**
     * Run {@code task} once after {@code delay}.
     */
    void schedule(String key, Duration delay, Runnable task);

    /**
     * Run {@code task} every {@code period}, first after one period.
     */
    void scheduleAtFixedRate(String key, Duration period, Runnable task);

    /**
     * @return {@code true} if a pending task was cancelled
     */
    boolean cancel(String key);

    boolean isScheduled(String key);

    /**
     * Cancel every pending task; the scheduler stays usable.
     */
    void cancelAll();

    @Override
    void close();
}
