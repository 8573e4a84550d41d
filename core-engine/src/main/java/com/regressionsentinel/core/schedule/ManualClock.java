package com.regressionsentinel.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Mutable {@link Clock} for driving virtual time, usually together with a
 * {@link ManualTaskScheduler}.
 */
public class ManualClock extends Clock {

    private volatile Instant now;
    private final ZoneId zone;

    public ManualClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private ManualClock(Instant start, ZoneId zone) {
        this.now = Objects.requireNonNull(start, "start must not be null");
        this.zone = zone;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new ManualClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }

    public void setInstant(Instant instant) {
        this.now = Objects.requireNonNull(instant, "instant must not be null");
    }

    public void advance(Duration duration) {
        this.now = now.plus(duration);
    }
}
