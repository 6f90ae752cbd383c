package com.intelcompliance.domain.exception;

import com.intelcompliance.domain.model.IncidentState;
import lombok.Getter;

/**
 * Illegal incident state-machine move.
 */
@Getter
public class InvalidTransitionException extends ComplianceException {

    private final IncidentState currentState;
    private final IncidentState requestedState;

    public InvalidTransitionException(IncidentState currentState, IncidentState requestedState) {
        super("Invalid incident transition: " + currentState + " -> " + requestedState);
        this.currentState = currentState;
        this.requestedState = requestedState;
    }
}
