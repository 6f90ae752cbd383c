package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.ContainmentAction;
import com.intelcompliance.domain.model.DetectionMethod;
import com.intelcompliance.domain.model.ForensicsCollectionType;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.IncidentTimelineEntry;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.ResponderRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Value
@Builder
public class IncidentReport {
    /** Stable for an unchanged incident; changes with every incident version. */
    String reportId;
    Summary summary;
    List<IncidentTimelineEntry> timeline;
    Impact impact;
    ContainmentSummary containment;
    List<ForensicsEntry> forensics;
    Set<String> responders;
    Set<ResponderRole> requiredRoles;
    List<String> recommendations;
    List<String> complianceNotes;
    Instant generatedAt;

    public record Summary(String incidentId, IncidentType type, IncidentSeverity severity, IncidentState state,
                          String description, DetectionMethod detectionMethod, Instant createdAt,
                          Instant responseDeadline, Instant escalatedAt, Instant resolvedAt) {
    }

    public record Impact(Set<String> affectedSystems, Set<String> affectedUsers, String sourceAddress,
                         boolean dataExposureSuspected) {
    }

    public record ContainmentSummary(long succeeded, long failed, List<ContainmentAction> actions) {
    }

    public record ForensicsEntry(UUID recordId, ForensicsCollectionType collectionType, Instant collectedAt,
                                 int snapshotCount, int logEntryCount, boolean signatureValid) {
    }
}
