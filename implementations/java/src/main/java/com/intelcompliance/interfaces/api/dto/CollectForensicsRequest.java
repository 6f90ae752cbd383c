package com.intelcompliance.interfaces.api.dto;

import com.intelcompliance.domain.model.ForensicsCollectionType;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectForensicsRequest {

    /** Defaults to FULL. */
    private ForensicsCollectionType collectionType;

    @Size(max = 512, message = "Source must not exceed 512 characters")
    private String source;
}
