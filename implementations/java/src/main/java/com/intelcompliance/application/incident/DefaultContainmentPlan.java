package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.ContainmentActionType;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.SecurityIncident;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.intelcompliance.domain.model.ContainmentActionType.BACKUP_EVIDENCE;
import static com.intelcompliance.domain.model.ContainmentActionType.BLOCK_NETWORK_ADDRESS;
import static com.intelcompliance.domain.model.ContainmentActionType.DISABLE_ACCOUNT;
import static com.intelcompliance.domain.model.ContainmentActionType.ISOLATE_SYSTEM;
import static com.intelcompliance.domain.model.ContainmentActionType.RESET_CREDENTIALS;
import static com.intelcompliance.domain.model.ContainmentActionType.TERMINATE_SESSIONS;

/**
 * Containment applied when a caller asks for containment without naming actions.
 *
 * <p>Targets come from the incident: user actions run once per affected user,
 * isolation once per affected system, address blocks against the source
 * address. Action types with no available target are left out.
 */
final class DefaultContainmentPlan {

    private static final Map<IncidentType, List<ContainmentActionType>> DEFAULTS = new EnumMap<>(IncidentType.class);

    static {
        DEFAULTS.put(IncidentType.DATA_BREACH, List.of(TERMINATE_SESSIONS, RESET_CREDENTIALS, BACKUP_EVIDENCE));
        DEFAULTS.put(IncidentType.UNAUTHORIZED_ACCESS, List.of(BLOCK_NETWORK_ADDRESS, DISABLE_ACCOUNT, TERMINATE_SESSIONS));
        DEFAULTS.put(IncidentType.BRUTE_FORCE, List.of(BLOCK_NETWORK_ADDRESS, RESET_CREDENTIALS));
        DEFAULTS.put(IncidentType.MALWARE, List.of(ISOLATE_SYSTEM, BACKUP_EVIDENCE));
        DEFAULTS.put(IncidentType.SYSTEM_COMPROMISE, List.of(ISOLATE_SYSTEM, TERMINATE_SESSIONS, BACKUP_EVIDENCE));
        DEFAULTS.put(IncidentType.DENIAL_OF_SERVICE, List.of(BLOCK_NETWORK_ADDRESS));
        DEFAULTS.put(IncidentType.INSIDER_THREAT, List.of(DISABLE_ACCOUNT, TERMINATE_SESSIONS, BACKUP_EVIDENCE));
        DEFAULTS.put(IncidentType.DATA_LOSS, List.of(TERMINATE_SESSIONS, BACKUP_EVIDENCE));
    }

    private DefaultContainmentPlan() {
    }

    static List<ContainmentRequest> forIncident(SecurityIncident incident) {
        List<ContainmentRequest> plan = new ArrayList<>();
        for (ContainmentActionType type : DEFAULTS.getOrDefault(incident.getType(), List.of(BACKUP_EVIDENCE))) {
            switch (type) {
                case TERMINATE_SESSIONS, DISABLE_ACCOUNT, RESET_CREDENTIALS ->
                    incident.getAffectedUsers().forEach(user -> plan.add(new ContainmentRequest(type, user)));
                case ISOLATE_SYSTEM ->
                    incident.getAffectedSystems().forEach(system -> plan.add(new ContainmentRequest(type, system)));
                case BLOCK_NETWORK_ADDRESS -> {
                    if (incident.getSourceAddress() != null) {
                        plan.add(new ContainmentRequest(type, incident.getSourceAddress()));
                    }
                }
                case BACKUP_EVIDENCE -> plan.add(new ContainmentRequest(type, null));
                default -> throw new IllegalStateException("No default targeting for " + type);
            }
        }
        return plan;
    }
}
