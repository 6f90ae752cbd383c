package com.intelcompliance.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class IncidentTimelineEntry {

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 32)
    private TimelineEntryType entryType;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", length = 16)
    private IncidentState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, length = 16)
    private IncidentState toState;

    @Column(name = "note", nullable = false, length = 2000)
    private String note;

    @Column(name = "actor", nullable = false, length = 128)
    private String actor;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
