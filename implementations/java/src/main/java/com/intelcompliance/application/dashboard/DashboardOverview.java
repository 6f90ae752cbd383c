package com.intelcompliance.application.dashboard;

import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.ComplianceScoreSnapshot;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.DetectionAlert;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class DashboardOverview {
    long eventsToday;
    long deniedToday;
    long activeIncidents;
    long criticalIncidents;
    List<DetectionAlert> recentAlerts;
    List<AuditEntry> recentAuditEntries;
    /** Latest recorded snapshot; null until one has been recorded. */
    ComplianceScoreSnapshot complianceScores;
    Instant generatedAt;

    /**
     * Audit event without its metadata.
     */
    public record AuditEntry(UUID id, String eventType, String action, String actorId, String resourceType,
                             String resourceId, AuditOutcome outcome, DataClassification classification,
                             Instant occurredAt) {
    }
}
