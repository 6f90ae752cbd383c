package com.intelcompliance.application.compliance;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Used until a training or policy-acknowledgement system is connected. With no
 * obligations tracked, the training area is reported as not applicable.
 */
@Component
public class UntrackedObligations implements ObligationTracker {

    @Override
    public List<TrackedObligation> trackedObligations() {
        return List.of();
    }
}
