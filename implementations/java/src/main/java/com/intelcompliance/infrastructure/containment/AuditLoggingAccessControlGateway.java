package com.intelcompliance.infrastructure.containment;

import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.infrastructure.audit.AuditEventCommand;
import com.intelcompliance.infrastructure.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default gateway: account owners pick requests up from the audit trail as
 * {@code CONTAINMENT_REQUESTED} events. A direct integration replaces it by
 * declaring a {@code @Primary} gateway.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditLoggingAccessControlGateway implements AccessControlGateway {

    private final AuditService auditService;

    @Override
    public void terminateSessions(String userId, String incidentId, String requestedBy) {
        request("terminate_sessions", userId, incidentId, requestedBy);
    }

    @Override
    public void disableAccount(String userId, String incidentId, String requestedBy) {
        request("disable_account", userId, incidentId, requestedBy);
    }

    @Override
    public void resetCredentials(String userId, String incidentId, String requestedBy) {
        request("reset_credentials", userId, incidentId, requestedBy);
    }

    private void request(String action, String userId, String incidentId, String requestedBy) {
        auditService.record(AuditEventCommand.builder()
            .eventType(AuditEventTypes.CONTAINMENT_REQUESTED)
            .action(action)
            .actorId(requestedBy)
            .resourceType("account")
            .resourceId(userId)
            .classification(DataClassification.SENSITIVE)
            .outcome(AuditOutcome.SUCCESS)
            .metadataEntry("incidentId", incidentId)
            .build());
        log.warn("INCIDENT {} requested {} for account {}", incidentId, action, userId);
    }
}
