package com.intelcompliance.domain.repository;

import com.intelcompliance.domain.model.DetectionAlert;

import java.time.Instant;
import java.util.List;

public interface DetectionAlertRepository {

    boolean existsByDedupeKey(String dedupeKey);

    /**
     * True when an alert for the same rule and group covers an event at or
     * after {@code eventsFrom}.
     */
    boolean existsOverlapping(String ruleId, String groupValue, Instant eventsFrom);

    DetectionAlert save(DetectionAlert alert);

    /**
     * Alerts detected at or after {@code since}, newest first.
     */
    List<DetectionAlert> findDetectedSince(Instant since, int limit);
}
