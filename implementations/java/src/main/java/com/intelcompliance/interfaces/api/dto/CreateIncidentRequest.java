package com.intelcompliance.interfaces.api.dto;

import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * Request DTO for opening an incident manually.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateIncidentRequest {

    @NotNull(message = "Incident type is required")
    private IncidentType type;

    @NotNull(message = "Severity is required")
    private IncidentSeverity severity;

    @NotBlank(message = "Description is required")
    @Size(max = 5000, message = "Description must not exceed 5000 characters")
    private String description;

    @Size(max = 64, message = "Source address must not exceed 64 characters")
    private String sourceAddress;

    @Size(max = 500, message = "At most 500 affected systems")
    private Set<String> affectedSystems;

    @Size(max = 500, message = "At most 500 affected users")
    private Set<String> affectedUsers;

    private Map<String, Object> initialFindings;
}
