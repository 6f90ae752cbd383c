package com.intelcompliance.infrastructure.audit;

import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Request to record an audit event. {@code occurredAt} defaults to now.
 */
@Value
@Builder
public class AuditEventCommand {
    String eventType;
    String action;
    String actorId;
    String resourceType;
    String resourceId;
    DataClassification classification;
    AuditOutcome outcome;
    String originAddress;
    String clientDescriptor;
    Instant occurredAt;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
