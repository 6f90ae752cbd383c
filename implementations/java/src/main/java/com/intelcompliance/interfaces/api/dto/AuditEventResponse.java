package com.intelcompliance.interfaces.api.dto;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit event as returned by the API. Sealed (CJI) metadata is never returned.
 */
@Value
@Builder
public class AuditEventResponse {
    UUID id;
    String eventType;
    String action;
    String actorId;
    String resourceType;
    String resourceId;
    DataClassification classification;
    AuditOutcome outcome;
    String originAddress;
    Instant occurredAt;
    boolean metadataSealed;
    Map<String, Object> metadata;

    public static AuditEventResponse from(AuditEvent event, Map<String, Object> metadata) {
        return AuditEventResponse.builder()
            .id(event.getId())
            .eventType(event.getEventType())
            .action(event.getAction())
            .actorId(event.getActorId())
            .resourceType(event.getResourceType())
            .resourceId(event.getResourceId())
            .classification(event.getClassification())
            .outcome(event.getOutcome())
            .originAddress(event.getOriginAddress())
            .occurredAt(event.getOccurredAt())
            .metadataSealed(event.isMetadataSealed())
            .metadata(event.isMetadataSealed() ? null : metadata)
            .build();
    }
}
