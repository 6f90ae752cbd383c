package com.intelcompliance.domain.exception;

/**
 * Authenticated decryption or signature verification failed.
 *
 * <p>Always fail-closed: no partial plaintext accompanies this exception.
 */
public class AuthenticationFailureException extends ComplianceException {

    public AuthenticationFailureException(String message) {
        super(message);
    }

    public AuthenticationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
