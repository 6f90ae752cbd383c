package com.intelcompliance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Public view of a managed key. Carries no key material.
 */
@Value
@Builder
public class KeyMetadata {
    String id;
    KeyPurpose purpose;
    String algorithm;
    KeyStatus status;
    int keyVersion;
    Instant createdAt;
    Instant rotationDueAt;
    Instant retiredAt;
    /** Truncated SHA-256 of the material, for correlation only. */
    String fingerprint;
}
