package com.intelcompliance.domain.model;

import lombok.Getter;

import java.time.Duration;

/**
 * Incident severity with the default time allowed before the incident must
 * leave the NEW state.
 */
@Getter
public enum IncidentSeverity {
    CRITICAL(Duration.ofMinutes(15), 4),
    HIGH(Duration.ofMinutes(60), 3),
    MEDIUM(Duration.ofMinutes(240), 2),
    LOW(Duration.ofMinutes(1440), 1);

    private final Duration defaultResponseDeadline;
    private final int rank;

    IncidentSeverity(Duration defaultResponseDeadline, int rank) {
        this.defaultResponseDeadline = defaultResponseDeadline;
        this.rank = rank;
    }

    public boolean isAtLeast(IncidentSeverity other) {
        return rank >= other.rank;
    }
}
