package com.intelcompliance.application.incident;

import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.config.PerformanceConfiguration.BusinessMetrics;
import com.intelcompliance.domain.exception.IncidentNotFoundException;
import com.intelcompliance.domain.exception.InvalidTransitionException;
import com.intelcompliance.domain.exception.NotFoundException;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.exception.ValidationException.Violation;
import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.ContainmentAction;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.ForensicsRecord;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.ResponderRole;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.domain.repository.ForensicsRecordRepository;
import com.intelcompliance.domain.repository.IncidentRepository;
import com.intelcompliance.infrastructure.audit.AuditEventCommand;
import com.intelcompliance.infrastructure.audit.AuditService;
import com.intelcompliance.infrastructure.containment.ContainmentDispatcher;
import com.intelcompliance.infrastructure.forensics.ForensicsCollector;
import com.intelcompliance.infrastructure.forensics.ForensicsContents;
import com.intelcompliance.infrastructure.serialization.CanonicalJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Incident lifecycle: creation, state changes, containment, forensics,
 * recovery planning, reporting and escalation.
 *
 * <p>Concurrency: every mutation of an incident runs under its
 * {@link IncidentLocks} entry and is saved before the lock is released. The
 * entity's optimistic version rejects writes from other processes. Audit
 * events are recorded after the lock is released.
 *
 * <p>All state changes are audited; audit failures propagate.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentResponseService {

    private static final int MAX_DESCRIPTION = 5000;
    private static final int MAX_NOTE = 1000;
    private static final int MAX_IDENTIFIER = 128;
    private static final int MAX_ADDRESS = 64;

    private final IncidentRepository incidentRepository;
    private final ForensicsRecordRepository forensicsRepository;
    private final AuditService auditService;
    private final ContainmentDispatcher containmentDispatcher;
    private final ForensicsCollector forensicsCollector;
    private final RecoveryPlanner recoveryPlanner;
    private final IncidentReportAssembler reportAssembler;
    private final IncidentLocks locks;
    private final IncidentIdGenerator idGenerator;
    private final ComplianceProperties properties;
    private final BusinessMetrics businessMetrics;
    private final Clock clock;

    /**
     * Opens a new incident in state NEW.
     *
     * @throws ValidationException if type, severity, detection method,
     *         description or creator are missing or out of bounds
     */
    public SecurityIncident createIncident(CreateIncidentCommand command) {
        validate(command);

        Instant now = clock.instant();
        String id = idGenerator.next(now);
        while (incidentRepository.findById(id).isPresent()) {
            id = idGenerator.next(now);
        }

        String findings = command.getInitialFindings() == null
            ? null : CanonicalJson.canonicalize(command.getInitialFindings());

        SecurityIncident incident = SecurityIncident.open(id, command.getType(), command.getSeverity(),
            command.getDescription().trim(), command.getDetectionMethod(), command.getSourceAddress(),
            command.getAffectedSystems(), command.getAffectedUsers(),
            requiredRoles(command.getSeverity(), command.getType()), findings, command.getCreatedBy(),
            now, now.plus(properties.getIncident().responseDeadlineFor(command.getSeverity())));

        SecurityIncident saved = incidentRepository.save(incident);

        audit(AuditEventTypes.INCIDENT_CREATED, "create", command.getCreatedBy(), saved, AuditOutcome.SUCCESS,
            Map.of("type", saved.getType().name(),
                "severity", saved.getSeverity().name(),
                "detectionMethod", saved.getDetectionMethod().getValue()));
        businessMetrics.recordIncidentCreated(saved.getType().name(), saved.getSeverity().name());
        log.warn("INCIDENT {} created: type={} severity={} detection={} deadline={}",
            saved.getId(), saved.getType(), saved.getSeverity(), saved.getDetectionMethod().getValue(),
            saved.getResponseDeadline());
        return saved;
    }

    /**
     * Moves an incident along the state machine.
     *
     * @throws InvalidTransitionException if the move is not allowed from the current state
     */
    public SecurityIncident updateIncidentState(String incidentId, IncidentState target, String note, String actor) {
        List<Violation> violations = new ArrayList<>();
        if (target == null) {
            violations.add(new Violation("state", "must not be null"));
        }
        requireText(violations, "note", note, MAX_NOTE);
        requireText(violations, "actor", actor, MAX_IDENTIFIER);
        throwIfAny(violations);

        IncidentState[] previous = new IncidentState[1];
        SecurityIncident updated = locks.withLock(incidentId, () -> {
            SecurityIncident incident = load(incidentId);
            previous[0] = incident.getState();
            incident.transitionTo(target, note.trim(), actor, clock.instant());
            return incidentRepository.save(incident);
        });

        audit(AuditEventTypes.INCIDENT_STATE_CHANGED, "transition", actor, updated, AuditOutcome.SUCCESS,
            Map.of("fromState", previous[0].name(), "toState", target.name(), "note", note.trim()));
        log.info("INCIDENT {} state {} -> {} by {}", incidentId, previous[0], target, actor);
        return updated;
    }

    public SecurityIncident assignResponder(String incidentId, String responderId, String actor) {
        List<Violation> violations = new ArrayList<>();
        requireText(violations, "responderId", responderId, MAX_IDENTIFIER);
        requireText(violations, "actor", actor, MAX_IDENTIFIER);
        throwIfAny(violations);

        boolean[] added = new boolean[1];
        SecurityIncident updated = locks.withLock(incidentId, () -> {
            SecurityIncident incident = load(incidentId);
            added[0] = incident.assignResponder(responderId.trim(), actor, clock.instant());
            return added[0] ? incidentRepository.save(incident) : incident;
        });

        if (added[0]) {
            audit(AuditEventTypes.INCIDENT_RESPONDER_ASSIGNED, "assign_responder", actor, updated,
                AuditOutcome.SUCCESS, Map.of("responderId", responderId.trim()));
        }
        return updated;
    }

    /**
     * Executes containment actions independently; failures are collected, not thrown.
     * With no actions given, the incident type's default containment applies.
     * When every action succeeds and the state allows it, the incident moves to CONTAINED.
     *
     * @throws InvalidTransitionException if the incident is already resolved or closed
     */
    public ContainmentResult containIncident(String incidentId, List<ContainmentRequest> requests, String actor) {
        List<Violation> violations = new ArrayList<>();
        requireText(violations, "actor", actor, MAX_IDENTIFIER);
        if (requests != null) {
            for (int i = 0; i < requests.size(); i++) {
                if (requests.get(i) == null || requests.get(i).type() == null) {
                    violations.add(new Violation("actions[" + i + "].type", "must not be null"));
                }
            }
        }
        throwIfAny(violations);

        IncidentState[] before = new IncidentState[1];
        List<ContainmentAction> executed = new ArrayList<>();
        Instant executedAt = clock.instant();

        SecurityIncident updated = locks.withLock(incidentId, () -> {
            SecurityIncident incident = load(incidentId);
            before[0] = incident.getState();
            if (!incident.isActive()) {
                throw new InvalidTransitionException(incident.getState(), IncidentState.CONTAINED);
            }

            List<ContainmentRequest> plan = requests == null || requests.isEmpty()
                ? DefaultContainmentPlan.forIncident(incident) : requests;
            for (ContainmentRequest request : plan) {
                executed.add(containmentDispatcher.dispatch(request.type(), request.target(), incident, actor));
            }
            incident.recordContainment(executed, actor, executedAt);

            boolean allSucceeded = !executed.isEmpty() && executed.stream().allMatch(ContainmentAction::succeeded);
            if (allSucceeded && incident.getState().canTransitionTo(IncidentState.CONTAINED)) {
                incident.transitionTo(IncidentState.CONTAINED, "All containment actions succeeded", actor, executedAt);
            }
            return incidentRepository.save(incident);
        });

        List<ContainmentAction> successful = executed.stream()
            .filter(ContainmentAction::succeeded).collect(Collectors.toList());
        List<ContainmentAction> failed = executed.stream()
            .filter(a -> !a.succeeded()).collect(Collectors.toList());
        failed.forEach(a -> businessMetrics.recordContainmentFailure(a.getType().name()));

        if (!executed.isEmpty()) {
            audit(AuditEventTypes.CONTAINMENT_EXECUTED, "contain", actor, updated,
                failed.isEmpty() ? AuditOutcome.SUCCESS : AuditOutcome.FAILURE,
                Map.of("succeeded", successful.size(),
                    "failed", failed.size(),
                    "actions", executed.stream().map(a -> a.getType().name()).collect(Collectors.toList())));
        }
        if (updated.getState() != before[0]) {
            audit(AuditEventTypes.INCIDENT_STATE_CHANGED, "transition", actor, updated, AuditOutcome.SUCCESS,
                Map.of("fromState", before[0].name(), "toState", updated.getState().name(),
                    "note", "All containment actions succeeded"));
        }
        log.warn("INCIDENT {} containment: {} succeeded, {} failed, state {}",
            incidentId, successful.size(), failed.size(), updated.getState());

        return ContainmentResult.builder()
            .incidentId(incidentId)
            .successful(List.copyOf(successful))
            .failed(List.copyOf(failed))
            .resultingState(updated.getState())
            .executedAt(executedAt)
            .build();
    }

    public ForensicsView collectForensics(ForensicsRequest request) {
        if (request == null) {
            throw new ValidationException("request", "must not be null");
        }
        List<Violation> violations = new ArrayList<>();
        requireText(violations, "incidentId", request.getIncidentId(), MAX_IDENTIFIER);
        requireText(violations, "requestedBy", request.getRequestedBy(), MAX_IDENTIFIER);
        if (request.getCollectionType() == null) {
            violations.add(new Violation("collectionType", "must not be null"));
        }
        throwIfAny(violations);

        ForensicsRecord[] collected = new ForensicsRecord[1];
        SecurityIncident updated = locks.withLock(request.getIncidentId(), () -> {
            SecurityIncident incident = load(request.getIncidentId());
            collected[0] = forensicsCollector.collect(incident, request.getCollectionType(),
                request.getSource(), request.getRequestedBy());
            incident.linkForensics(collected[0].getId().toString(), request.getRequestedBy(), clock.instant());
            return incidentRepository.save(incident);
        });

        ForensicsRecord record = collected[0];
        audit(AuditEventTypes.FORENSICS_COLLECTED, "collect_forensics", request.getRequestedBy(), updated,
            AuditOutcome.SUCCESS, Map.of("recordId", record.getId().toString(),
                "collectionType", record.getCollectionType().name(),
                "snapshotCount", record.getSnapshotCount(),
                "logEntryCount", record.getLogEntryCount()));
        return toView(record, forensicsCollector.unseal(record));
    }

    /**
     * Decrypts a forensics record and re-verifies its signature.
     */
    public ForensicsView getForensicsRecord(UUID recordId) {
        ForensicsRecord record = forensicsRepository.findById(recordId)
            .orElseThrow(() -> new NotFoundException("Forensics record not found: " + recordId));
        return toView(record, forensicsCollector.unseal(record));
    }

    public RecoveryPlan generateRecoveryPlan(String incidentId) {
        return recoveryPlanner.plan(getIncident(incidentId), clock.instant());
    }

    public IncidentReport generateIncidentReport(String incidentId, String actor) {
        SecurityIncident incident = getIncident(incidentId);
        List<IncidentReport.ForensicsEntry> forensics = forensicsRepository.findByIncidentId(incidentId).stream()
            .sorted(Comparator.comparing(ForensicsRecord::getCollectedAt))
            .map(record -> new IncidentReport.ForensicsEntry(record.getId(), record.getCollectionType(),
                record.getCollectedAt(), record.getSnapshotCount(), record.getLogEntryCount(),
                forensicsCollector.unseal(record).signatureValid()))
            .collect(Collectors.toList());
        IncidentReport report = reportAssembler.assemble(incident, forensics, clock.instant());
        audit(AuditEventTypes.INCIDENT_REPORT_GENERATED, "generate_report", actor, incident, AuditOutcome.SUCCESS,
            Map.of("reportId", report.getReportId(), "forensicsRecords", forensics.size()));
        return report;
    }

    /**
     * Flags NEW incidents past their response deadline. Each incident is
     * escalated at most once.
     *
     * @return incidents escalated by this run
     */
    @Scheduled(fixedDelayString = "${compliance.incident.escalation-interval:PT1M}")
    public List<SecurityIncident> escalateOverdueIncidents() {
        Instant now = clock.instant();
        List<SecurityIncident> escalated = new ArrayList<>();

        for (SecurityIncident candidate : incidentRepository.findByStates(EnumSet.of(IncidentState.NEW))) {
            if (!candidate.isOverdue(now) || candidate.isEscalated()) {
                continue;
            }
            Optional<SecurityIncident> result = locks.withLock(candidate.getId(), () -> {
                SecurityIncident incident = load(candidate.getId());
                if (!incident.isOverdue(now) || incident.isEscalated()) {
                    return Optional.empty();
                }
                incident.escalate("Response deadline " + incident.getResponseDeadline() + " exceeded", now);
                return Optional.of(incidentRepository.save(incident));
            });
            result.ifPresent(incident -> {
                log.error("SECURITY ALERT: INCIDENT {} ({} {}) exceeded its response deadline {}",
                    incident.getId(), incident.getSeverity(), incident.getType(), incident.getResponseDeadline());
                businessMetrics.recordIncidentEscalated(incident.getSeverity().name());
                audit(AuditEventTypes.INCIDENT_ESCALATED, "escalate", "system", incident, AuditOutcome.SUCCESS,
                    Map.of("reason", "Response deadline exceeded",
                        "responseDeadline", incident.getResponseDeadline().toString()));
                escalated.add(incident);
            });
        }
        return escalated;
    }

    public SecurityIncident getIncident(String incidentId) {
        return load(incidentId);
    }

    /**
     * Incidents newest first, optionally restricted to one state.
     */
    public List<SecurityIncident> listIncidents(IncidentState state) {
        List<SecurityIncident> incidents = state == null
            ? incidentRepository.findAll()
            : incidentRepository.findByStates(Set.of(state));
        return incidents.stream()
            .sorted(Comparator.comparing(SecurityIncident::getCreatedAt).reversed())
            .collect(Collectors.toList());
    }

    /**
     * Roles required for an incident: a commander for CRITICAL and HIGH, an
     * analyst always, legal for breaches and insider threats, and a privacy
     * officer whenever CJI may have been exposed.
     */
    static Set<ResponderRole> requiredRoles(IncidentSeverity severity, IncidentType type) {
        Set<ResponderRole> roles = EnumSet.of(ResponderRole.SECURITY_ANALYST);
        if (severity.isAtLeast(IncidentSeverity.HIGH)) {
            roles.add(ResponderRole.INCIDENT_COMMANDER);
        }
        if (type == IncidentType.DATA_BREACH || type == IncidentType.INSIDER_THREAT) {
            roles.add(ResponderRole.LEGAL_ADVISOR);
        }
        if (type.impliesDataExposure()) {
            roles.add(ResponderRole.PRIVACY_OFFICER);
        }
        return roles;
    }

    private SecurityIncident load(String incidentId) {
        if (incidentId == null || incidentId.isBlank()) {
            throw new IncidentNotFoundException(String.valueOf(incidentId));
        }
        return incidentRepository.findById(incidentId)
            .orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    private void audit(String eventType, String action, String actor, SecurityIncident incident,
                       AuditOutcome outcome, Map<String, ?> metadata) {
        AuditEventCommand.AuditEventCommandBuilder command = AuditEventCommand.builder()
            .eventType(eventType)
            .action(action)
            .actorId(actor)
            .resourceType("incident")
            .resourceId(incident.getId())
            .classification(incident.getType().impliesDataExposure()
                ? DataClassification.CJI : DataClassification.SENSITIVE)
            .outcome(outcome);
        metadata.forEach(command::metadataEntry);
        auditService.record(command.build());
    }

    private static ForensicsView toView(ForensicsRecord record, ForensicsContents contents) {
        return ForensicsView.builder()
            .recordId(record.getId())
            .incidentId(record.getIncidentId())
            .collectionType(record.getCollectionType())
            .source(record.getSourceDescriptor())
            .snapshotCount(record.getSnapshotCount())
            .logEntryCount(record.getLogEntryCount())
            .snapshotsJson(contents.snapshotsJson())
            .logExtractJson(contents.logExtractJson())
            .signatureValid(contents.signatureValid())
            .collectedBy(record.getCollectedBy())
            .collectedAt(record.getCollectedAt())
            .build();
    }

    private static void validate(CreateIncidentCommand command) {
        if (command == null) {
            throw new ValidationException("command", "must not be null");
        }
        List<Violation> violations = new ArrayList<>();
        if (command.getType() == null) {
            violations.add(new Violation("type", "must not be null"));
        }
        if (command.getSeverity() == null) {
            violations.add(new Violation("severity", "must not be null"));
        }
        if (command.getDetectionMethod() == null) {
            violations.add(new Violation("detectionMethod", "must not be null"));
        }
        requireText(violations, "description", command.getDescription(), MAX_DESCRIPTION);
        requireText(violations, "createdBy", command.getCreatedBy(), MAX_IDENTIFIER);
        if (command.getSourceAddress() != null && command.getSourceAddress().length() > MAX_ADDRESS) {
            violations.add(new Violation("sourceAddress", "exceeds " + MAX_ADDRESS + " characters"));
        }
        checkIdentifiers(violations, "affectedSystems", command.getAffectedSystems());
        checkIdentifiers(violations, "affectedUsers", command.getAffectedUsers());
        throwIfAny(violations);
    }

    private static void checkIdentifiers(List<Violation> violations, String field, Set<String> values) {
        for (String value : values) {
            if (value == null || value.isBlank() || value.length() > MAX_IDENTIFIER) {
                violations.add(new Violation(field, "entries must be 1-" + MAX_IDENTIFIER + " characters: "
                    + Encode.forJava(String.valueOf(value))));
            }
        }
    }

    private static void requireText(List<Violation> violations, String field, String value, int max) {
        if (value == null || value.isBlank()) {
            violations.add(new Violation(field, "must not be blank"));
        } else if (value.length() > max) {
            violations.add(new Violation(field, "exceeds " + max + " characters"));
        }
    }

    private static void throwIfAny(List<Violation> violations) {
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }
}
