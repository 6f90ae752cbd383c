package com.intelcompliance.domain.exception;

/**
 * A referenced entity does not exist or is no longer usable.
 *
 * <p>Distinct from transient unavailability, which surfaces as a persistence
 * or provider failure instead.
 */
public class NotFoundException extends ComplianceException {

    public NotFoundException(String message) {
        super(message);
    }
}
