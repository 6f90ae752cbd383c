package com.intelcompliance.domain.model;

public enum ContainmentActionType {
    ISOLATE_SYSTEM,
    TERMINATE_SESSIONS,
    DISABLE_ACCOUNT,
    RESET_CREDENTIALS,
    BLOCK_NETWORK_ADDRESS,
    BACKUP_EVIDENCE
}
