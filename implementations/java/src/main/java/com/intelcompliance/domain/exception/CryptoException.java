package com.intelcompliance.domain.exception;

/**
 * Cryptographic provider failure unrelated to authentication of the input.
 */
public class CryptoException extends ComplianceException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
