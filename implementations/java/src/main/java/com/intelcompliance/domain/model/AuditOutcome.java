package com.intelcompliance.domain.model;

public enum AuditOutcome {
    SUCCESS,
    DENIED,
    FAILURE
}
