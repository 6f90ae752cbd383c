package com.intelcompliance.domain.exception;

import lombok.Getter;

/**
 * Unknown or revoked key identifier.
 */
@Getter
public class KeyNotFoundException extends NotFoundException {

    private final String keyId;

    public KeyNotFoundException(String keyId) {
        super("Key not found or revoked: " + keyId);
        this.keyId = keyId;
    }
}
