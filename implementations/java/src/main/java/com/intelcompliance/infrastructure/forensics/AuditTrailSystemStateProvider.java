package com.intelcompliance.infrastructure.forensics;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.infrastructure.audit.AuditEventFilter;
import com.intelcompliance.infrastructure.audit.AuditService;
import com.intelcompliance.infrastructure.containment.SystemIsolationExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Default snapshot: what the audit trail knows about a system within the window.
 */
@Component
@RequiredArgsConstructor
public class AuditTrailSystemStateProvider implements SystemStateProvider {

    private final AuditService auditService;
    private final SystemIsolationExecutor isolation;
    private final Clock clock;

    @Override
    public Map<String, Object> capture(String systemId, TimeWindow window) {
        List<AuditEvent> events = auditService.queryWindow(AuditEventFilter.ALL, window).stream()
            .filter(e -> systemId.equals(e.getResourceId()))
            .collect(Collectors.toList());

        Map<String, Long> byType = new TreeMap<>(events.stream()
            .collect(Collectors.groupingBy(AuditEvent::getEventType, Collectors.counting())));

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("systemId", systemId);
        snapshot.put("capturedAt", clock.instant().toString());
        snapshot.put("windowStart", window.from().toString());
        snapshot.put("windowEnd", window.to().toString());
        snapshot.put("isolated", isolation.isIsolated(systemId));
        snapshot.put("eventCount", events.size());
        snapshot.put("deniedCount", events.stream().filter(AuditEvent::isDenied).count());
        snapshot.put("failureCount", events.stream().filter(e -> e.getOutcome() == AuditOutcome.FAILURE).count());
        snapshot.put("eventsByType", byType);
        snapshot.put("distinctActors", events.stream()
            .map(AuditEvent::getActorId)
            .filter(a -> a != null)
            .distinct()
            .sorted()
            .collect(Collectors.toList()));
        snapshot.put("lastActivityAt", events.stream()
            .max(Comparator.comparing(AuditEvent::getOccurredAt))
            .map(e -> e.getOccurredAt().toString())
            .orElse(null));
        return snapshot;
    }
}
