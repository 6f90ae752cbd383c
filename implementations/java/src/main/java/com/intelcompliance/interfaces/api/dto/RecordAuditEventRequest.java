package com.intelcompliance.interfaces.api.dto;

import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A collaborator reporting a security-relevant action. Actor defaults to the
 * authenticated caller and origin to the request's remote address.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordAuditEventRequest {

    @NotBlank(message = "Event type is required")
    @Size(max = 64)
    private String eventType;

    @NotBlank(message = "Action is required")
    @Size(max = 128)
    private String action;

    @Size(max = 128)
    private String actorId;

    @Size(max = 64)
    private String resourceType;

    @Size(max = 256)
    private String resourceId;

    @NotNull(message = "Classification is required")
    private DataClassification classification;

    @NotNull(message = "Outcome is required")
    private AuditOutcome outcome;

    @Size(max = 64)
    private String originAddress;

    private Map<String, Object> metadata;
}
