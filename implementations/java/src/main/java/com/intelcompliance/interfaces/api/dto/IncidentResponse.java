package com.intelcompliance.interfaces.api.dto;

import com.intelcompliance.domain.model.ContainmentAction;
import com.intelcompliance.domain.model.DetectionMethod;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.IncidentTimelineEntry;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.ResponderRole;
import com.intelcompliance.domain.model.SecurityIncident;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@Value
@Builder
public class IncidentResponse {
    String id;
    IncidentType type;
    IncidentSeverity severity;
    IncidentState state;
    Set<IncidentState> allowedTransitions;
    String description;
    DetectionMethod detectionMethod;
    String sourceAddress;
    Set<String> affectedSystems;
    Set<String> affectedUsers;
    Set<String> responders;
    Set<ResponderRole> requiredRoles;
    String initialFindings;
    List<IncidentTimelineEntry> timeline;
    List<ContainmentAction> containmentActions;
    List<String> forensicRecordIds;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;
    Instant responseDeadline;
    Instant escalatedAt;

    public static IncidentResponse from(SecurityIncident incident) {
        return IncidentResponse.builder()
            .id(incident.getId())
            .type(incident.getType())
            .severity(incident.getSeverity())
            .state(incident.getState())
            .allowedTransitions(incident.getState().allowedTransitions())
            .description(incident.getDescription())
            .detectionMethod(incident.getDetectionMethod())
            .sourceAddress(incident.getSourceAddress())
            .affectedSystems(Set.copyOf(incident.getAffectedSystems()))
            .affectedUsers(Set.copyOf(incident.getAffectedUsers()))
            .responders(Set.copyOf(incident.getResponders()))
            .requiredRoles(Set.copyOf(incident.getRequiredRoles()))
            .initialFindings(incident.getInitialFindings())
            .timeline(List.copyOf(incident.getTimeline()))
            .containmentActions(List.copyOf(incident.getContainmentActions()))
            .forensicRecordIds(List.copyOf(incident.getForensicRecordIds()))
            .createdBy(incident.getCreatedBy())
            .createdAt(incident.getCreatedAt())
            .updatedAt(incident.getUpdatedAt())
            .responseDeadline(incident.getResponseDeadline())
            .escalatedAt(incident.getEscalatedAt())
            .build();
    }
}
