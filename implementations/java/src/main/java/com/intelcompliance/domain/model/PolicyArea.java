package com.intelcompliance.domain.model;

import lombok.Getter;

/**
 * Compliance dimensions scored independently.
 */
@Getter
public enum PolicyArea {
    ACCESS_CONTROL("Access Control"),
    IDENTIFICATION_AUTHENTICATION("Identification and Authentication"),
    AUDITING_ACCOUNTABILITY("Auditing and Accountability"),
    INCIDENT_RESPONSE("Incident Response"),
    SECURITY_AWARENESS_TRAINING("Security Awareness Training"),
    SYSTEMS_COMMUNICATIONS_PROTECTION("Systems and Communications Protection");

    private final String displayName;

    PolicyArea(String displayName) {
        this.displayName = displayName;
    }
}
