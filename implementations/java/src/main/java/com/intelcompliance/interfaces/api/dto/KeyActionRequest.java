package com.intelcompliance.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class KeyActionRequest {

    @NotBlank(message = "A reason is required")
    @Size(max = 256, message = "Reason must not exceed 256 characters")
    private String reason;
}
