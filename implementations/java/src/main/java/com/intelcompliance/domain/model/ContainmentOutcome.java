package com.intelcompliance.domain.model;

public enum ContainmentOutcome {
    SUCCEEDED,
    FAILED
}
