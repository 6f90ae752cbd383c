package com.intelcompliance.interfaces.api.dto;

import com.intelcompliance.domain.model.ContainmentActionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Containment actions to run. An empty list applies the incident type's defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContainIncidentRequest {

    @Valid
    @Size(max = 50, message = "At most 50 actions per request")
    private List<Action> actions = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Action {

        @NotNull(message = "Action type is required")
        private ContainmentActionType type;

        @Size(max = 256, message = "Target must not exceed 256 characters")
        private String target;
    }
}
