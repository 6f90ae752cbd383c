package com.intelcompliance.infrastructure.containment;

import com.intelcompliance.domain.model.ContainmentActionType;
import com.intelcompliance.domain.model.SecurityIncident;

/**
 * Strategy carrying out one kind of containment action.
 */
public interface ContainmentExecutor {

    boolean supports(ContainmentActionType type);

    /**
     * Executes the action against {@code target}.
     *
     * @param incident incident being contained; the caller holds its lock and saves it afterwards
     * @return human-readable detail recorded with the action
     * @throws ContainmentException if the action could not be carried out
     */
    String execute(ContainmentActionType type, String target, SecurityIncident incident, String actor);
}
