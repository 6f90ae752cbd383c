package com.intelcompliance.application.compliance;

import com.intelcompliance.application.compliance.ComplianceReport.AreaResult;
import com.intelcompliance.application.compliance.ComplianceReport.Metrics;
import com.intelcompliance.application.compliance.ComplianceReport.ViolationSummary;
import com.intelcompliance.application.compliance.ObligationTracker.TrackedObligation;
import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.ComplianceScoreSnapshot;
import com.intelcompliance.domain.model.ComplianceStatus;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.IncidentTimelineEntry;
import com.intelcompliance.domain.model.KeyMetadata;
import com.intelcompliance.domain.model.PolicyArea;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.domain.repository.ComplianceSnapshotRepository;
import com.intelcompliance.domain.repository.IncidentRepository;
import com.intelcompliance.infrastructure.audit.AuditEventFilter;
import com.intelcompliance.infrastructure.audit.AuditService;
import com.intelcompliance.infrastructure.audit.AuditVerificationResult;
import com.intelcompliance.infrastructure.crypto.KeyManagementService;
import com.intelcompliance.infrastructure.crypto.KeyReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Scores compliance per policy area from audit, incident, key and obligation
 * evidence.
 *
 * <p>Every area is a ratio scaled to 0-100. An area without evidence scores
 * 100, except security awareness training, which is left out entirely when
 * no obligations are tracked. Scores are always evaluated relative to the end
 * of the period, so a report over a closed period is reproducible.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ComplianceScoringService {

    static final Set<String> DATA_ACCESS_TYPES = Set.of(
        AuditEventTypes.DATA_ACCESS,
        AuditEventTypes.DATA_EXPORT,
        AuditEventTypes.FILE_UPLOAD,
        AuditEventTypes.FILE_DOWNLOAD,
        AuditEventTypes.ACCESS_DENIED);

    private static final int MAX_TREND = 365;
    private static final int MAX_VIOLATION_TYPES = 10;
    private static final double INCIDENT_RESOLUTION_WEIGHT = 0.7;
    private static final double INCIDENT_TRIAGE_WEIGHT = 0.3;

    private final AuditService auditService;
    private final IncidentRepository incidentRepository;
    private final KeyManagementService keyManagementService;
    private final ObligationTracker obligationTracker;
    private final ComplianceSnapshotRepository snapshotRepository;
    private final ComplianceProperties properties;
    private final Clock clock;

    /**
     * Scores the trailing scoring period ending now. Nothing is persisted.
     */
    public ComplianceScoreSnapshot calculateComplianceScore() {
        Instant now = clock.instant();
        TimeWindow period = TimeWindow.through(now, properties.getScoring().getDefaultPeriod());
        Evidence evidence = gather(period);
        return new ComplianceScoreSnapshot(UUID.randomUUID(), evidence.scores(), evidence.deniedCount(),
            overall(evidence.scores()), period, now);
    }

    @Scheduled(cron = "${compliance.scoring.snapshot-cron:0 0 * * * *}")
    public ComplianceScoreSnapshot recordSnapshot() {
        ComplianceScoreSnapshot saved = snapshotRepository.save(calculateComplianceScore());
        log.info("Compliance snapshot {} recorded: overall={} violations={}",
            saved.getId(), saved.getOverallScore(), saved.getViolationCount());
        return saved;
    }

    /**
     * Recorded snapshots, newest first.
     */
    public List<ComplianceScoreSnapshot> complianceTrend(int limit) {
        if (limit < 1 || limit > MAX_TREND) {
            throw new ValidationException("limit", "must be between 1 and " + MAX_TREND);
        }
        return snapshotRepository.findRecent(limit);
    }

    /**
     * @throws ValidationException if the period is empty or inverted
     */
    public ComplianceReport generateComplianceReport(Instant start, Instant end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new ValidationException("period", "start must be before end");
        }
        TimeWindow period = new TimeWindow(start, end);
        Evidence evidence = gather(period);
        double overall = overall(evidence.scores());

        List<AreaResult> areas = new ArrayList<>();
        for (PolicyArea area : PolicyArea.values()) {
            Double score = evidence.scores().get(area);
            areas.add(new AreaResult(area, area.getDisplayName(), score,
                score == null ? ComplianceStatus.NOT_APPLICABLE : statusOf(score),
                properties.getScoring().weightOf(area)));
        }

        List<AuditEvent> events = evidence.events();
        Metrics metrics = new Metrics(
            events.size(),
            evidence.deniedCount(),
            events.stream().filter(e -> e.getClassification() == DataClassification.CJI)
                .filter(e -> DATA_ACCESS_TYPES.contains(e.getEventType())).count(),
            events.stream().map(AuditEvent::getActorId).filter(Objects::nonNull).distinct().count(),
            events.stream().map(AuditEvent::getOriginAddress).filter(Objects::nonNull).distinct().count(),
            evidence.incidents().size(),
            evidence.incidents().stream().filter(i -> resolvedBy(i, end)).count());

        List<ViolationSummary> violations = events.stream()
            .filter(AuditEvent::isDenied)
            .collect(Collectors.groupingBy(AuditEvent::getEventType, Collectors.counting()))
            .entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Long>comparingByKey()))
            .limit(MAX_VIOLATION_TYPES)
            .map(e -> new ViolationSummary(e.getKey(), e.getValue(), violationSeverity(e.getValue())))
            .collect(Collectors.toList());

        ComplianceStatus overallStatus = statusOf(overall);
        return ComplianceReport.builder()
            .periodStart(start)
            .periodEnd(end)
            .overallScore(overall)
            .overallStatus(overallStatus)
            .areas(List.copyOf(areas))
            .metrics(metrics)
            .violations(violations)
            .recommendations(recommendations(areas, violations))
            .executiveSummary(executiveSummary(overall, overallStatus, areas, metrics))
            .generatedAt(clock.instant())
            .build();
    }

    /**
     * Current gaps, most severe first and lowest score first within a severity.
     */
    public List<ComplianceGap> identifyComplianceGaps() {
        Instant now = clock.instant();
        Evidence evidence = gather(TimeWindow.through(now, properties.getScoring().getDefaultPeriod()));
        double compliant = properties.getScoring().getCompliantThreshold();

        List<ComplianceGap> gaps = new ArrayList<>();
        evidence.scores().forEach((area, score) -> {
            if (score < compliant) {
                gaps.add(new ComplianceGap(area,
                    area.getDisplayName() + " scored " + score + ", below the " + compliant + " threshold",
                    gapSeverity(score), recommendationFor(area), score));
            }
        });

        for (SecurityIncident incident : incidentRepository.findByStates(EnumSet.of(IncidentState.NEW))) {
            if (incident.isOverdue(now)) {
                gaps.add(new ComplianceGap(PolicyArea.INCIDENT_RESPONSE,
                    "Incident " + incident.getId() + " (" + incident.getSeverity() + " " + incident.getType()
                        + ") missed its response deadline " + incident.getResponseDeadline(),
                    IncidentSeverity.HIGH, "Triage the incident and assign an incident commander", null));
            }
        }

        for (TrackedObligation obligation : obligationTracker.trackedObligations()) {
            if (obligation.isOverdue(now)) {
                gaps.add(new ComplianceGap(PolicyArea.SECURITY_AWARENESS_TRAINING,
                    "Obligation " + obligation.id() + " for " + obligation.assignee() + " overdue since "
                        + obligation.dueAt(),
                    IncidentSeverity.MEDIUM, "Complete " + obligation.description(), null));
            }
        }

        gaps.sort(Comparator.comparingInt((ComplianceGap g) -> g.severity().getRank()).reversed()
            .thenComparing(ComplianceGap::score, Comparator.nullsLast(Comparator.naturalOrder())));
        return gaps;
    }

    public ComplianceStatus statusOf(double score) {
        if (score >= properties.getScoring().getCompliantThreshold()) {
            return ComplianceStatus.COMPLIANT;
        }
        if (score >= properties.getScoring().getAtRiskThreshold()) {
            return ComplianceStatus.AT_RISK;
        }
        return ComplianceStatus.NON_COMPLIANT;
    }

    private Evidence gather(TimeWindow period) {
        Instant reference = period.to();
        List<AuditEvent> events = auditService.queryWindow(AuditEventFilter.ALL, period);
        List<SecurityIncident> incidents = incidentRepository.findCreatedIn(period);

        Map<PolicyArea, Double> scores = new EnumMap<>(PolicyArea.class);
        scores.put(PolicyArea.ACCESS_CONTROL, accessControl(events));
        scores.put(PolicyArea.IDENTIFICATION_AUTHENTICATION, authentication(events));
        scores.put(PolicyArea.AUDITING_ACCOUNTABILITY, auditing(period));
        scores.put(PolicyArea.INCIDENT_RESPONSE, incidentResponse(incidents, reference));
        Double training = training(reference);
        if (training != null) {
            scores.put(PolicyArea.SECURITY_AWARENESS_TRAINING, training);
        }
        scores.put(PolicyArea.SYSTEMS_COMMUNICATIONS_PROTECTION, keyHygiene(reference));

        long denied = events.stream().filter(AuditEvent::isDenied).count();
        return new Evidence(scores, events, incidents, denied);
    }

    private static double accessControl(List<AuditEvent> events) {
        long granted = 0;
        long denied = 0;
        for (AuditEvent event : events) {
            if (!DATA_ACCESS_TYPES.contains(event.getEventType())) {
                continue;
            }
            if (event.getOutcome() == AuditOutcome.SUCCESS) {
                granted++;
            } else if (event.getOutcome() == AuditOutcome.DENIED) {
                denied++;
            }
        }
        return ratio(granted, granted + denied);
    }

    private static double authentication(List<AuditEvent> events) {
        long succeeded = events.stream()
            .filter(e -> AuditEventTypes.LOGIN_SUCCESS.equals(e.getEventType())).count();
        long failed = events.stream()
            .filter(e -> AuditEventTypes.LOGIN_FAILED.equals(e.getEventType())).count();
        return ratio(succeeded, succeeded + failed);
    }

    private double auditing(TimeWindow period) {
        AuditVerificationResult result = auditService.inspectIntegrity(period);
        return ratio(result.validRecords(), result.getTotalRecords());
    }

    private static double incidentResponse(List<SecurityIncident> incidents, Instant reference) {
        if (incidents.isEmpty()) {
            return 100.0;
        }
        long resolved = incidents.stream().filter(i -> resolvedBy(i, reference)).count();
        long triagedOnTime = incidents.stream().filter(i -> triagedOnTime(i, reference)).count();
        double score = INCIDENT_RESOLUTION_WEIGHT * resolved / incidents.size()
            + INCIDENT_TRIAGE_WEIGHT * triagedOnTime / incidents.size();
        return round(score * 100.0);
    }

    private Double training(Instant reference) {
        List<TrackedObligation> obligations = obligationTracker.trackedObligations();
        if (obligations.isEmpty()) {
            return null;
        }
        long completed = obligations.stream()
            .filter(o -> o.isCompleted() && !o.completedAt().isAfter(reference))
            .count();
        return ratio(completed, obligations.size());
    }

    private double keyHygiene(Instant reference) {
        KeyReport report = keyManagementService.keyReport();
        long overdue = report.getRotationsDue().stream()
            .map(KeyMetadata::getRotationDueAt)
            .filter(due -> due.isBefore(reference))
            .count();
        return ratio(report.getActiveKeys() - overdue, report.getActiveKeys());
    }

    private static boolean resolvedBy(SecurityIncident incident, Instant reference) {
        return incident.enteredStateAt(IncidentState.RESOLVED)
            .map(at -> at.isBefore(reference))
            .orElse(false);
    }

    private static boolean triagedOnTime(SecurityIncident incident, Instant reference) {
        return incident.getTimeline().stream()
            .filter(e -> e.getFromState() == IncidentState.NEW && e.getToState() != IncidentState.NEW)
            .map(IncidentTimelineEntry::getOccurredAt)
            .findFirst()
            .map(at -> at.isBefore(reference) && !at.isAfter(incident.getResponseDeadline()))
            .orElse(false);
    }

    private double overall(Map<PolicyArea, Double> scores) {
        double weighted = 0;
        double totalWeight = 0;
        for (Map.Entry<PolicyArea, Double> entry : scores.entrySet()) {
            double weight = properties.getScoring().weightOf(entry.getKey());
            weighted += entry.getValue() * weight;
            totalWeight += weight;
        }
        return totalWeight == 0 ? 100.0 : round(weighted / totalWeight);
    }

    private static double ratio(long numerator, long denominator) {
        if (denominator <= 0) {
            return 100.0;
        }
        return round(100.0 * numerator / denominator);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private IncidentSeverity gapSeverity(double score) {
        if (score < 50.0) {
            return IncidentSeverity.CRITICAL;
        }
        if (score < properties.getScoring().getAtRiskThreshold()) {
            return IncidentSeverity.HIGH;
        }
        return IncidentSeverity.MEDIUM;
    }

    private static IncidentSeverity violationSeverity(long count) {
        if (count >= 100) {
            return IncidentSeverity.CRITICAL;
        }
        if (count >= 25) {
            return IncidentSeverity.HIGH;
        }
        if (count >= 5) {
            return IncidentSeverity.MEDIUM;
        }
        return IncidentSeverity.LOW;
    }

    private static String recommendationFor(PolicyArea area) {
        return switch (area) {
            case ACCESS_CONTROL -> "Review role assignments and data access policies for users with repeated denials";
            case IDENTIFICATION_AUTHENTICATION -> "Enforce multi-factor authentication and review account lockout settings";
            case AUDITING_ACCOUNTABILITY -> "Investigate audit records that failed integrity verification";
            case INCIDENT_RESPONSE -> "Reduce time to triage and drive open incidents to resolution";
            case SECURITY_AWARENESS_TRAINING -> "Follow up on outstanding security awareness obligations";
            case SYSTEMS_COMMUNICATIONS_PROTECTION -> "Rotate encryption keys that are past their rotation date";
        };
    }

    private List<String> recommendations(List<AreaResult> areas, List<ViolationSummary> violations) {
        List<String> recommendations = new ArrayList<>();
        areas.stream()
            .filter(a -> a.status() == ComplianceStatus.NON_COMPLIANT || a.status() == ComplianceStatus.AT_RISK)
            .sorted(Comparator.comparing(AreaResult::score))
            .forEach(a -> recommendations.add(recommendationFor(a.area())));
        violations.stream()
            .filter(v -> v.severity().isAtLeast(IncidentSeverity.HIGH))
            .forEach(v -> recommendations.add("Investigate the volume of denied " + v.eventType() + " events"));
        if (recommendations.isEmpty()) {
            recommendations.add("Maintain current controls and continue periodic review");
        }
        return List.copyOf(recommendations);
    }

    private static String executiveSummary(double overall, ComplianceStatus status, List<AreaResult> areas,
                                           Metrics metrics) {
        long belowTarget = areas.stream()
            .filter(a -> a.status() == ComplianceStatus.AT_RISK || a.status() == ComplianceStatus.NON_COMPLIANT)
            .count();
        return String.format(Locale.ROOT,
            "Overall compliance score %.2f (%s). %d of %d policy areas below target. "
                + "%d audit events recorded, %d denied. %d incidents opened, %d resolved.",
            overall, status, belowTarget, areas.size(), metrics.totalEvents(), metrics.deniedEvents(),
            metrics.incidentsOpened(), metrics.incidentsResolved());
    }

    private record Evidence(Map<PolicyArea, Double> scores, List<AuditEvent> events,
                            List<SecurityIncident> incidents, long deniedCount) {
    }
}
