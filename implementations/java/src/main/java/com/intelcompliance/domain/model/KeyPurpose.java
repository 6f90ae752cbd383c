package com.intelcompliance.domain.model;

/**
 * What a managed key may be used for. A key never serves two purposes.
 */
public enum KeyPurpose {
    PUBLIC_DATA,
    SENSITIVE_DATA,
    CJI_DATA,
    INTEGRITY_SIGNING,
    /** Reserved for the root wrapping key; never issued. */
    KEY_WRAPPING;

    public boolean isEncryptionPurpose() {
        return this == PUBLIC_DATA || this == SENSITIVE_DATA || this == CJI_DATA;
    }

    public boolean isIssuable() {
        return this != KEY_WRAPPING;
    }
}
