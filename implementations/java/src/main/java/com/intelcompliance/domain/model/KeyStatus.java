package com.intelcompliance.domain.model;

public enum KeyStatus {
    /** Used for new encryptions and signatures. */
    ACTIVE,
    /** Decrypt and verify only. */
    RETIRED,
    /** Unusable; lookups fail as not found. */
    REVOKED
}
