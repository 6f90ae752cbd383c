package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.ResponderRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class RecoveryPlan {
    String incidentId;
    IncidentType incidentType;
    IncidentSeverity severity;
    List<Step> steps;
    List<String> validationChecks;
    /** Sum of the step estimates. */
    long estimatedDurationMinutes;
    Instant generatedAt;

    public record Step(int order, String title, String description, long estimatedMinutes, ResponderRole owner) {
    }
}
