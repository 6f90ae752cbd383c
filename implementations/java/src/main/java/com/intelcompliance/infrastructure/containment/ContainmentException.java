package com.intelcompliance.infrastructure.containment;

import com.intelcompliance.domain.exception.ComplianceException;

/**
 * A containment action could not be carried out. Recorded as a failed
 * action on the incident; never aborts the remaining actions.
 */
public class ContainmentException extends ComplianceException {

    public ContainmentException(String message) {
        super(message);
    }

    public ContainmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
