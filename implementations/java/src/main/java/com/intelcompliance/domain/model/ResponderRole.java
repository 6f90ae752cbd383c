package com.intelcompliance.domain.model;

public enum ResponderRole {
    INCIDENT_COMMANDER,
    SECURITY_ANALYST,
    LEGAL_ADVISOR,
    PRIVACY_OFFICER
}
