package com.intelcompliance.domain.model;

public enum IncidentType {
    DATA_BREACH,
    UNAUTHORIZED_ACCESS,
    BRUTE_FORCE,
    MALWARE,
    DENIAL_OF_SERVICE,
    INSIDER_THREAT,
    DATA_LOSS,
    SYSTEM_COMPROMISE,
    POLICY_VIOLATION,
    PHYSICAL_BREACH;

    /** Types that imply criminal justice information may have been exposed. */
    public boolean impliesDataExposure() {
        return this == DATA_BREACH || this == DATA_LOSS;
    }
}
