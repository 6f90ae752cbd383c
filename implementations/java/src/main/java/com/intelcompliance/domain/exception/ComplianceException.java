package com.intelcompliance.domain.exception;

/**
 * Root of the compliance core's exception taxonomy.
 *
 * <p>Subclasses map one-to-one onto the error categories surfaced to
 * collaborators: validation, authentication failure, not-found, invalid
 * transition, corruption and persistence failure.
 */
public abstract class ComplianceException extends RuntimeException {

    protected ComplianceException(String message) {
        super(message);
    }

    protected ComplianceException(String message, Throwable cause) {
        super(message, cause);
    }
}
