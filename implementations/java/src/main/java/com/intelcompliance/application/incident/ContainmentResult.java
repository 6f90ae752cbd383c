package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.ContainmentAction;
import com.intelcompliance.domain.model.IncidentState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ContainmentResult {
    String incidentId;
    List<ContainmentAction> successful;
    List<ContainmentAction> failed;
    /** State after containment; CONTAINED when every action succeeded and the move was allowed. */
    IncidentState resultingState;
    Instant executedAt;

    public boolean isComplete() {
        return failed.isEmpty() && !successful.isEmpty();
    }
}
