package com.intelcompliance.interfaces.api.dto;

import com.intelcompliance.domain.model.IncidentState;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StateTransitionRequest {

    @NotNull(message = "Target state is required")
    private IncidentState state;

    @NotBlank(message = "A note is required for every transition")
    @Size(max = 1000, message = "Note must not exceed 1000 characters")
    private String note;
}
