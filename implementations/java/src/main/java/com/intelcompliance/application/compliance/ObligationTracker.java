package com.intelcompliance.application.compliance;

import java.time.Instant;
import java.util.List;

/**
 * Source of training-equivalent obligations (awareness courses, policy
 * acknowledgements) tracked outside this service.
 *
 * <p>Implementations are read-only from the scoring engine's point of view.
 */
public interface ObligationTracker {

    List<TrackedObligation> trackedObligations();

    /**
     * @param completedAt null while the obligation is outstanding
     */
    record TrackedObligation(String id, String description, String assignee, Instant dueAt, Instant completedAt) {

        public boolean isCompleted() {
            return completedAt != null;
        }

        public boolean isOverdue(Instant now) {
            return completedAt == null && dueAt != null && now.isAfter(dueAt);
        }
    }
}
