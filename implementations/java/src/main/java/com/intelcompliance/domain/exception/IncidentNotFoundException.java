package com.intelcompliance.domain.exception;

import lombok.Getter;

@Getter
public class IncidentNotFoundException extends NotFoundException {

    private final String incidentId;

    public IncidentNotFoundException(String incidentId) {
        super("Incident not found: " + incidentId);
        this.incidentId = incidentId;
    }
}
