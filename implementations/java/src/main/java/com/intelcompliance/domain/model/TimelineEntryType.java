package com.intelcompliance.domain.model;

public enum TimelineEntryType {
    CREATED,
    STATE_CHANGE,
    CONTAINMENT,
    FORENSICS,
    RESPONDER_ASSIGNED,
    ESCALATION
}
