package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.domain.model.KeyPurpose;

import java.time.Instant;

/**
 * Published after a key is created, rotated or revoked.
 */
public record KeyLifecycleEvent(Action action, String keyId, KeyPurpose purpose,
                                String previousKeyId, String reason, Instant occurredAt) {

    public enum Action {
        CREATED,
        ROTATED,
        REVOKED
    }
}
