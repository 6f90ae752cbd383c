package com.intelcompliance.domain.model;

public enum ComplianceStatus {
    COMPLIANT,
    AT_RISK,
    NON_COMPLIANT,
    NOT_APPLICABLE
}
