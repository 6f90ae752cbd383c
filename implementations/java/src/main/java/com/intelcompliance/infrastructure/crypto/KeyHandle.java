package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.domain.model.KeyPurpose;

import javax.crypto.SecretKey;
import java.util.Objects;

/**
 * Unwrapped key material paired with its identifier. Only handed from the key
 * management service to the encryption engine; never serialised or logged.
 */
public final class KeyHandle {

    private final String keyId;
    private final KeyPurpose purpose;
    private final SecretKey material;

    KeyHandle(String keyId, KeyPurpose purpose, SecretKey material) {
        this.keyId = Objects.requireNonNull(keyId);
        this.purpose = Objects.requireNonNull(purpose);
        this.material = Objects.requireNonNull(material);
    }

    public String keyId() {
        return keyId;
    }

    public KeyPurpose purpose() {
        return purpose;
    }

    SecretKey material() {
        return material;
    }

    @Override
    public String toString() {
        return "KeyHandle[keyId=" + keyId + ", purpose=" + purpose + "]";
    }
}
