package com.intelcompliance.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [from, to)}.
 */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow {
        Objects.requireNonNull(from, "Window start must not be null");
        Objects.requireNonNull(to, "Window end must not be null");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Window end precedes start: " + from + " > " + to);
        }
    }

    public static TimeWindow endingAt(Instant end, Duration length) {
        return new TimeWindow(end.minus(length), end);
    }

    /**
     * Window of {@code length} whose last included instant is {@code end},
     * at millisecond resolution.
     */
    public static TimeWindow through(Instant end, Duration length) {
        Instant exclusiveEnd = end.plusMillis(1);
        return new TimeWindow(exclusiveEnd.minus(length), exclusiveEnd);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && instant.isBefore(to);
    }

    public Duration length() {
        return Duration.between(from, to);
    }
}
