package com.intelcompliance.support;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.domain.repository.AuditEventRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryAuditEventRepository implements AuditEventRepository {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    /**
     * Makes every following append throw, as a lost database connection would.
     */
    public void failAppends(boolean failing) {
        this.failing = failing;
    }

    /**
     * Swaps a stored event for a modified copy, bypassing the append-only contract.
     */
    public void overwrite(AuditEvent replacement) {
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i).getId().equals(replacement.getId())) {
                events.set(i, replacement);
                return;
            }
        }
        throw new IllegalArgumentException("No stored event " + replacement.getId());
    }

    public List<AuditEvent> all() {
        return new ArrayList<>(events);
    }

    public List<AuditEvent> ofType(String eventType) {
        return events.stream()
            .filter(e -> e.getEventType().equals(eventType))
            .collect(Collectors.toList());
    }

    @Override
    public AuditEvent append(AuditEvent event) {
        if (failing) {
            throw new IllegalStateException("audit store unavailable");
        }
        events.add(event);
        return event;
    }

    @Override
    public Optional<AuditEvent> findById(UUID id) {
        return events.stream().filter(e -> e.getId().equals(id)).findFirst();
    }

    @Override
    public List<AuditEvent> findInWindow(TimeWindow window, Collection<String> eventTypes) {
        return events.stream()
            .filter(e -> window.contains(e.getOccurredAt()))
            .filter(e -> eventTypes.isEmpty() || eventTypes.contains(e.getEventType()))
            .sorted(Comparator.comparing(AuditEvent::getOccurredAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<AuditEvent> findRecent(int limit) {
        return events.stream()
            .sorted(Comparator.comparing(AuditEvent::getOccurredAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long countInWindow(TimeWindow window) {
        return events.stream().filter(e -> window.contains(e.getOccurredAt())).count();
    }

    @Override
    public long countInWindowByOutcome(TimeWindow window, AuditOutcome outcome) {
        return events.stream()
            .filter(e -> window.contains(e.getOccurredAt()))
            .filter(e -> e.getOutcome() == outcome)
            .count();
    }

    @Override
    public int deleteOlderThan(DataClassification classification, Instant cutoff) {
        List<AuditEvent> expired = events.stream()
            .filter(e -> e.getClassification() == classification)
            .filter(e -> e.getOccurredAt().isBefore(cutoff))
            .collect(Collectors.toList());
        events.removeAll(expired);
        return expired.size();
    }
}
