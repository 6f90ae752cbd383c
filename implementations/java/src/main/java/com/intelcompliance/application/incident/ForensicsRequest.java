package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.ForensicsCollectionType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ForensicsRequest {
    String incidentId;
    @Builder.Default
    ForensicsCollectionType collectionType = ForensicsCollectionType.FULL;
    /** Free-text description of where the evidence came from. */
    String source;
    String requestedBy;
}
