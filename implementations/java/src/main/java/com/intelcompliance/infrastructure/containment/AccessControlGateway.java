package com.intelcompliance.infrastructure.containment;

/**
 * Port to the component that owns user accounts and sessions.
 *
 * <p>Implementations throw {@link ContainmentException} when a request cannot
 * be honoured.
 */
public interface AccessControlGateway {

    void terminateSessions(String userId, String incidentId, String requestedBy);

    void disableAccount(String userId, String incidentId, String requestedBy);

    void resetCredentials(String userId, String incidentId, String requestedBy);
}
