package com.intelcompliance.domain.exception;

/**
 * Decryption succeeded but the plaintext checksum does not match the one
 * captured at encryption time.
 */
public class FileCorruptionException extends ComplianceException {

    public FileCorruptionException(String message) {
        super(message);
    }
}
