package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.DetectionMethod;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

@Value
@Builder
public class CreateIncidentCommand {
    IncidentType type;
    IncidentSeverity severity;
    String description;
    DetectionMethod detectionMethod;
    String sourceAddress;
    @Singular
    Set<String> affectedSystems;
    @Singular
    Set<String> affectedUsers;
    /** Structured evidence; stored as canonical JSON. */
    Map<String, Object> initialFindings;
    String createdBy;
}
