package com.intelcompliance.domain.repository;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.TimeWindow;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only audit event store.
 *
 * <p>Implementations must not offer update operations. The single deletion
 * path is {@link #deleteOlderThan}, used by the retention purge.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface AuditEventRepository {

    /**
     * Appends a new event.
     *
     * @param event fully signed event
     * @return the stored event
     * @throws RuntimeException any persistence failure; callers must not swallow it
     */
    AuditEvent append(AuditEvent event);

    Optional<AuditEvent> findById(UUID id);

    /**
     * Events with {@code window.from <= occurredAt < window.to}, oldest first.
     *
     * @param window time window
     * @param eventTypes restrict to these types; empty means all types
     */
    List<AuditEvent> findInWindow(TimeWindow window, Collection<String> eventTypes);

    /**
     * Most recent events first.
     */
    List<AuditEvent> findRecent(int limit);

    long countInWindow(TimeWindow window);

    long countInWindowByOutcome(TimeWindow window, AuditOutcome outcome);

    /**
     * Retention purge. Removes events of the given classification older than the cutoff.
     *
     * @return number of events removed
     */
    int deleteOlderThan(DataClassification classification, Instant cutoff);
}
