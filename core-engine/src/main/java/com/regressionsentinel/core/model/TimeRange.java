package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval {@code [start, end]}.
 *
 * @since 1.0.0
 */
public final class TimeRange {

    private final Instant start;
    private final Instant end;

    @JsonCreator
    public TimeRange(@JsonProperty("start") Instant start, @JsonProperty("end") Instant end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    /**
     * Range covering the given duration up to {@code end}.
     *
     * @param end      inclusive end of the range
     * @param duration length of the range
     * @return the range {@code [end - duration, end]}
     */
    public static TimeRange lookback(Instant end, Duration duration) {
        return new TimeRange(end.minus(duration), end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    /**
     * @param instant the instant to test
     * @return {@code true} if {@code start <= instant <= end}
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeRange that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
