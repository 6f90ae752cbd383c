package com.intelcompliance.domain.exception;

/**
 * An audit event could not be persisted. Never swallowed.
 */
public class AuditPersistenceException extends ComplianceException {

    public AuditPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
