package com.intelcompliance.application.dashboard;

import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.domain.repository.AuditEventRepository;
import com.intelcompliance.domain.repository.ComplianceSnapshotRepository;
import com.intelcompliance.domain.repository.DetectionAlertRepository;
import com.intelcompliance.domain.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Read-only views for the security dashboard. Computed from persisted state
 * on every call; empty stores produce zero counts and empty lists.
 */
@Service
@RequiredArgsConstructor
public class SecurityDashboardService {

    private static final int RECENT_AUDIT_ENTRIES = 20;
    private static final int RECENT_ALERTS = 50;
    private static final Duration ALERT_LOOKBACK = Duration.ofHours(24);

    private final AuditEventRepository auditEventRepository;
    private final IncidentRepository incidentRepository;
    private final DetectionAlertRepository alertRepository;
    private final ComplianceSnapshotRepository snapshotRepository;
    private final Clock clock;

    public DashboardOverview overview() {
        Instant now = clock.instant();
        Instant startOfDay = LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay().toInstant(ZoneOffset.UTC);
        TimeWindow today = new TimeWindow(startOfDay, now.plusMillis(1));

        List<SecurityIncident> active = incidentRepository.findByStates(EnumSet.of(IncidentState.NEW,
            IncidentState.TRIAGED, IncidentState.CONTAINED, IncidentState.INVESTIGATING, IncidentState.RECOVERING));

        return DashboardOverview.builder()
            .eventsToday(auditEventRepository.countInWindow(today))
            .deniedToday(auditEventRepository.countInWindowByOutcome(today, AuditOutcome.DENIED))
            .activeIncidents(active.size())
            .criticalIncidents(active.stream().filter(i -> i.getSeverity() == IncidentSeverity.CRITICAL).count())
            .recentAlerts(alertRepository.findDetectedSince(now.minus(ALERT_LOOKBACK), RECENT_ALERTS))
            .recentAuditEntries(auditEventRepository.findRecent(RECENT_AUDIT_ENTRIES).stream()
                .map(SecurityDashboardService::toEntry)
                .collect(Collectors.toList()))
            .complianceScores(snapshotRepository.findLatest().orElse(null))
            .generatedAt(now)
            .build();
    }

    /**
     * Counts for incidents created in {@code [start, end)}.
     */
    public IncidentStatistics incidentStatistics(Instant start, Instant end) {
        if (start == null || end == null || end.isBefore(start)) {
            throw new ValidationException("period", "start must not be after end");
        }
        List<SecurityIncident> incidents = incidentRepository.findCreatedIn(new TimeWindow(start, end));

        Map<IncidentType, Long> byType = new EnumMap<>(IncidentType.class);
        Map<IncidentSeverity, Long> bySeverity = new EnumMap<>(IncidentSeverity.class);
        Map<IncidentState, Long> byState = new EnumMap<>(IncidentState.class);
        for (SecurityIncident incident : incidents) {
            byType.merge(incident.getType(), 1L, Long::sum);
            bySeverity.merge(incident.getSeverity(), 1L, Long::sum);
            byState.merge(incident.getState(), 1L, Long::sum);
        }

        OptionalDouble averageMinutes = incidents.stream()
            .flatMap(i -> i.enteredStateAt(IncidentState.RESOLVED).stream()
                .map(resolvedAt -> Duration.between(i.getCreatedAt(), resolvedAt)))
            .mapToDouble(d -> d.toMillis() / 60_000.0)
            .average();

        return IncidentStatistics.builder()
            .periodStart(start)
            .periodEnd(end)
            .totalIncidents(incidents.size())
            .byType(byType)
            .bySeverity(bySeverity)
            .byState(byState)
            .averageTimeToResolveMinutes(averageMinutes.isPresent()
                ? BigDecimal.valueOf(averageMinutes.getAsDouble()).setScale(2, RoundingMode.HALF_UP).doubleValue()
                : null)
            .build();
    }

    private static DashboardOverview.AuditEntry toEntry(AuditEvent event) {
        return new DashboardOverview.AuditEntry(event.getId(), event.getEventType(), event.getAction(),
            event.getActorId(), event.getResourceType(), event.getResourceId(), event.getOutcome(),
            event.getClassification(), event.getOccurredAt());
    }
}
