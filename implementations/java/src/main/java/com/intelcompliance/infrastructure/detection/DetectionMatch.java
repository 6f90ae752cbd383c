package com.intelcompliance.infrastructure.detection;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A group whose aggregate exceeded a rule's threshold.
 *
 * @param eventIds ids of the contributing events, capped at {@link PatternDetector#MAX_EVENT_IDS}
 * @param dedupeKey rule, group and window bucket of the first event; one incident per key
 */
public record DetectionMatch(DetectionRule rule, String groupValue, long aggregateValue,
                             long eventCount, Instant firstEventAt, Instant lastEventAt,
                             List<UUID> eventIds, String dedupeKey) {
}
