package com.intelcompliance.domain.model;

public enum ForensicsCollectionType {
    /** System snapshots, log extract and network context. */
    FULL,
    SYSTEM_STATE,
    LOG_EXTRACT
}
