package com.intelcompliance.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignResponderRequest {

    @NotBlank(message = "Responder id is required")
    @Size(max = 128, message = "Responder id must not exceed 128 characters")
    private String responderId;
}
