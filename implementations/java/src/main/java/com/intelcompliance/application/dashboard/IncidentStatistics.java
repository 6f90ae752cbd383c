package com.intelcompliance.application.dashboard;

import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.IncidentType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class IncidentStatistics {
    Instant periodStart;
    Instant periodEnd;
    long totalIncidents;
    Map<IncidentType, Long> byType;
    Map<IncidentSeverity, Long> bySeverity;
    Map<IncidentState, Long> byState;
    /** Mean minutes from creation to RESOLVED; null when nothing was resolved. */
    Double averageTimeToResolveMinutes;
}
