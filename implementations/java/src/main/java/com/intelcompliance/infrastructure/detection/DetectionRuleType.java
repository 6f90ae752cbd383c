package com.intelcompliance.infrastructure.detection;

public enum DetectionRuleType {
    /** Number of matching events per group. */
    EVENT_COUNT,
    /** Sum of a numeric metadata field per group. */
    METADATA_SUM
}
