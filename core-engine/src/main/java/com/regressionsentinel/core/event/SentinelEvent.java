package com.regressionsentinel.core.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Base class of every notification published by the engines and the
 * framework.
 */
public abstract class SentinelEvent {

    private final Instant timestamp;

    protected SentinelEvent(Instant timestamp) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the event's topic name, for example {@code anomalyDetected}
     */
    public abstract String topic();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{timestamp=" + timestamp + '}';
    }
}
