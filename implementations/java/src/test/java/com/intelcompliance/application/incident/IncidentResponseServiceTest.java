package com.intelcompliance.application.incident;

import com.intelcompliance.domain.exception.IncidentNotFoundException;
import com.intelcompliance.domain.exception.InvalidTransitionException;
import com.intelcompliance.domain.exception.NotFoundException;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.ContainmentActionType;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.DetectionMethod;
import com.intelcompliance.domain.model.ForensicsCollectionType;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.ResponderRole;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.domain.model.TimelineEntryType;
import com.intelcompliance.support.ComplianceTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IncidentResponseServiceTest {

    private ComplianceTestContext ctx;
    private IncidentResponseService service;

    @BeforeEach
    void setUp() {
        ctx = new ComplianceTestContext();
        service = ctx.getIncidentService();
    }

    @Test
    void create_opens_new_incident_with_deadline_and_roles() {
        SecurityIncident incident = service.createIncident(command(IncidentType.UNAUTHORIZED_ACCESS,
            IncidentSeverity.HIGH).build());

        assertTrue(incident.getId().matches("^INC-\\d{14}-[0-9A-F]{8}$"), incident.getId());
        assertEquals(IncidentState.NEW, incident.getState());
        assertEquals(DetectionMethod.MANUAL, incident.getDetectionMethod());
        assertEquals(ComplianceTestContext.START.plus(Duration.ofMinutes(60)), incident.getResponseDeadline());
        assertTrue(incident.getRequiredRoles().contains(ResponderRole.INCIDENT_COMMANDER));
        assertEquals(1, incident.getTimeline().size());
        assertEquals(TimelineEntryType.CREATED, incident.getTimeline().get(0).getEntryType());

        List<AuditEvent> created = ctx.getAuditRepository().ofType(AuditEventTypes.INCIDENT_CREATED);
        assertEquals(1, created.size());
        assertEquals(incident.getId(), created.get(0).getResourceId());
        assertEquals(DataClassification.SENSITIVE, created.get(0).getClassification());
    }

    @Test
    void data_exposure_incident_is_audited_at_cji_tier() {
        SecurityIncident incident = service.createIncident(command(IncidentType.DATA_BREACH,
            IncidentSeverity.CRITICAL).build());

        assertTrue(incident.getRequiredRoles().containsAll(List.of(ResponderRole.LEGAL_ADVISOR,
            ResponderRole.PRIVACY_OFFICER, ResponderRole.INCIDENT_COMMANDER)));
        AuditEvent created = ctx.getAuditRepository().ofType(AuditEventTypes.INCIDENT_CREATED).get(0);
        assertEquals(DataClassification.CJI, created.getClassification());
        assertTrue(created.isMetadataSealed());
    }

    @Test
    void configured_deadline_overrides_severity_default() {
        ctx.getProperties().getIncident().getResponseDeadlines().put(IncidentSeverity.LOW, Duration.ofHours(2));

        SecurityIncident incident = service.createIncident(command(IncidentType.POLICY_VIOLATION,
            IncidentSeverity.LOW).build());

        assertEquals(ComplianceTestContext.START.plus(Duration.ofHours(2)), incident.getResponseDeadline());
    }

    @Test
    void create_rejects_incomplete_command() {
        ValidationException e = assertThrows(ValidationException.class, () -> service.createIncident(
            CreateIncidentCommand.builder()
                .severity(IncidentSeverity.LOW)
                .description("  ")
                .detectionMethod(DetectionMethod.MANUAL)
                .createdBy("analyst-7")
                .build()));

        List<String> fields = e.getViolations().stream()
            .map(ValidationException.Violation::field)
            .collect(Collectors.toList());
        assertEquals(List.of("type", "description"), fields);
        assertTrue(ctx.getIncidentRepository().findAll().isEmpty());
        assertTrue(ctx.getAuditRepository().all().isEmpty());
    }

    @Test
    void incident_walks_the_whole_lifecycle() {
        String id = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.MEDIUM).build()).getId();

        IncidentState[] path = {IncidentState.TRIAGED, IncidentState.CONTAINED, IncidentState.INVESTIGATING,
            IncidentState.RECOVERING, IncidentState.RESOLVED, IncidentState.CLOSED};
        for (IncidentState next : path) {
            ctx.getClock().advance(Duration.ofMinutes(5));
            assertEquals(next, service.updateIncidentState(id, next, "moving to " + next, "analyst-7").getState());
        }

        SecurityIncident closed = service.getIncident(id);
        assertEquals(7, closed.getTimeline().size());
        assertFalse(closed.isActive());
        assertEquals(6, ctx.getAuditRepository().ofType(AuditEventTypes.INCIDENT_STATE_CHANGED).size());
    }

    @Test
    void investigation_can_return_to_containment() {
        String id = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.MEDIUM).build()).getId();
        service.updateIncidentState(id, IncidentState.TRIAGED, "ack", "analyst-7");
        service.updateIncidentState(id, IncidentState.CONTAINED, "isolated", "analyst-7");
        service.updateIncidentState(id, IncidentState.INVESTIGATING, "analysis", "analyst-7");

        assertEquals(IncidentState.CONTAINED,
            service.updateIncidentState(id, IncidentState.CONTAINED, "second host found", "analyst-7").getState());
    }

    @Test
    void skipping_to_closed_is_rejected() {
        String id = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.MEDIUM).build()).getId();

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
            () -> service.updateIncidentState(id, IncidentState.CLOSED, "done", "analyst-7"));

        assertEquals(IncidentState.NEW, e.getCurrentState());
        assertEquals(IncidentState.NEW, service.getIncident(id).getState());
        assertTrue(ctx.getAuditRepository().ofType(AuditEventTypes.INCIDENT_STATE_CHANGED).isEmpty());
    }

    @Test
    void transition_needs_note_and_actor() {
        String id = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.MEDIUM).build()).getId();

        assertThrows(ValidationException.class,
            () -> service.updateIncidentState(id, IncidentState.TRIAGED, " ", "analyst-7"));
        assertThrows(ValidationException.class,
            () -> service.updateIncidentState(id, IncidentState.TRIAGED, "ack", null));
        assertThrows(ValidationException.class,
            () -> service.updateIncidentState(id, null, "ack", "analyst-7"));
    }

    @Test
    void unknown_incident_is_not_found() {
        assertThrows(IncidentNotFoundException.class, () -> service.getIncident("INC-00000000000000-00000000"));
        assertThrows(IncidentNotFoundException.class,
            () -> service.updateIncidentState("missing", IncidentState.TRIAGED, "ack", "analyst-7"));
    }

    @Test
    void partial_containment_reports_both_outcomes() {
        String id = triagedIncident(IncidentType.UNAUTHORIZED_ACCESS);

        ContainmentResult result = service.containIncident(id, List.of(
            new ContainmentRequest(ContainmentActionType.BLOCK_NETWORK_ADDRESS, "10.0.0.1"),
            new ContainmentRequest(ContainmentActionType.BLOCK_NETWORK_ADDRESS, "not-an-address")), "analyst-7");

        assertEquals(1, result.getSuccessful().size());
        assertEquals(1, result.getFailed().size());
        assertEquals("not-an-address", result.getFailed().get(0).getTarget());
        assertFalse(result.isComplete());
        assertEquals(IncidentState.TRIAGED, result.getResultingState());
        assertTrue(ctx.getNetworkBlocker().isBlocked("10.0.0.1"));

        SecurityIncident incident = service.getIncident(id);
        assertEquals(2, incident.getContainmentActions().size());
        AuditEvent executed = ctx.getAuditRepository().ofType(AuditEventTypes.CONTAINMENT_EXECUTED).get(0);
        assertEquals(AuditOutcome.FAILURE, executed.getOutcome());
        assertEquals(1.0, ((Number) ctx.getAudit().metadataOf(executed).get("failed")).doubleValue());
    }

    @Test
    void successful_containment_moves_triaged_incident_to_contained() {
        String id = triagedIncident(IncidentType.MALWARE);

        ContainmentResult result = service.containIncident(id, List.of(
            new ContainmentRequest(ContainmentActionType.ISOLATE_SYSTEM, "records-db")), "analyst-7");

        assertTrue(result.isComplete());
        assertEquals(IncidentState.CONTAINED, result.getResultingState());
        assertTrue(ctx.getIsolation().isIsolated("records-db"));
        assertEquals(IncidentState.CONTAINED, service.getIncident(id).getState());
    }

    @Test
    void containment_on_new_incident_keeps_it_new() {
        String id = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.MEDIUM).build()).getId();

        ContainmentResult result = service.containIncident(id, List.of(
            new ContainmentRequest(ContainmentActionType.ISOLATE_SYSTEM, "records-db")), "analyst-7");

        assertTrue(result.isComplete());
        assertEquals(IncidentState.NEW, result.getResultingState());
    }

    @Test
    void empty_containment_request_uses_type_defaults() {
        String id = service.createIncident(command(IncidentType.BRUTE_FORCE, IncidentSeverity.MEDIUM)
            .sourceAddress("10.0.0.1")
            .affectedUser("jdoe")
            .build()).getId();

        ContainmentResult result = service.containIncident(id, List.of(), "analyst-7");

        List<ContainmentActionType> types = result.getSuccessful().stream()
            .map(a -> a.getType())
            .collect(Collectors.toList());
        assertEquals(List.of(ContainmentActionType.BLOCK_NETWORK_ADDRESS, ContainmentActionType.RESET_CREDENTIALS),
            types);
        assertTrue(result.getFailed().isEmpty());
        assertTrue(ctx.getNetworkBlocker().isBlocked("10.0.0.1"));
    }

    @Test
    void resolved_incident_cannot_be_contained() {
        String id = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.MEDIUM).build()).getId();
        for (IncidentState next : List.of(IncidentState.TRIAGED, IncidentState.CONTAINED,
                IncidentState.INVESTIGATING, IncidentState.RECOVERING, IncidentState.RESOLVED)) {
            service.updateIncidentState(id, next, "step", "analyst-7");
        }

        assertThrows(InvalidTransitionException.class, () -> service.containIncident(id, List.of(
            new ContainmentRequest(ContainmentActionType.ISOLATE_SYSTEM, "records-db")), "analyst-7"));
        assertFalse(ctx.getIsolation().isIsolated("records-db"));
    }

    @Test
    void containment_request_without_type_is_rejected() {
        String id = triagedIncident(IncidentType.MALWARE);

        assertThrows(ValidationException.class, () -> service.containIncident(id,
            List.of(new ContainmentRequest(null, "records-db")), "analyst-7"));
    }

    @Test
    void collected_forensics_read_back_unchanged() {
        ctx.record(AuditEventTypes.ACCESS_DENIED, "read", "jdoe", "10.0.0.1", AuditOutcome.DENIED,
            DataClassification.SENSITIVE);
        String id = service.createIncident(command(IncidentType.UNAUTHORIZED_ACCESS, IncidentSeverity.HIGH)
            .sourceAddress("10.0.0.1")
            .build()).getId();

        ForensicsView collected = service.collectForensics(ForensicsRequest.builder()
            .incidentId(id)
            .collectionType(ForensicsCollectionType.FULL)
            .requestedBy("analyst-7")
            .build());
        ForensicsView readBack = service.getForensicsRecord(collected.getRecordId());

        assertTrue(collected.isSignatureValid());
        assertTrue(readBack.isSignatureValid());
        assertEquals(collected.getSnapshotsJson(), readBack.getSnapshotsJson());
        assertEquals(collected.getLogExtractJson(), readBack.getLogExtractJson());
        assertEquals(1, collected.getLogEntryCount());
        assertEquals(List.of(collected.getRecordId().toString()), service.getIncident(id).getForensicRecordIds());
        assertEquals(1, ctx.getAuditRepository().ofType(AuditEventTypes.FORENSICS_COLLECTED).size());
    }

    @Test
    void unknown_forensics_record_is_not_found() {
        assertThrows(NotFoundException.class, () -> service.getForensicsRecord(UUID.randomUUID()));
    }

    @Test
    void responder_assignment_is_idempotent() {
        String id = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.MEDIUM).build()).getId();

        service.assignResponder(id, "responder-1", "lead");
        SecurityIncident incident = service.assignResponder(id, "responder-1", "lead");

        assertEquals(1, incident.getResponders().size());
        assertEquals(1, ctx.getAuditRepository().ofType(AuditEventTypes.INCIDENT_RESPONDER_ASSIGNED).size());
    }

    @Test
    void concurrent_transitions_apply_exactly_once() throws Exception {
        String id = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.MEDIUM).build()).getId();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String actor = "analyst-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        service.updateIncidentState(id, IncidentState.TRIAGED, "ack", actor);
                        return true;
                    } catch (InvalidTransitionException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int applied = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    applied++;
                }
            }
            assertEquals(1, applied);
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        SecurityIncident incident = service.getIncident(id);
        assertEquals(IncidentState.TRIAGED, incident.getState());
        assertEquals(2, incident.getTimeline().size());
        assertEquals(1, ctx.getAuditRepository().ofType(AuditEventTypes.INCIDENT_STATE_CHANGED).size());
    }

    @Test
    void overdue_incidents_are_escalated_once() {
        SecurityIncident critical = service.createIncident(command(IncidentType.SYSTEM_COMPROMISE,
            IncidentSeverity.CRITICAL).build());
        String triaged = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.CRITICAL).build())
            .getId();
        service.updateIncidentState(triaged, IncidentState.TRIAGED, "ack", "analyst-7");

        ctx.getClock().advance(Duration.ofMinutes(15));
        assertTrue(service.escalateOverdueIncidents().isEmpty());

        ctx.getClock().advance(Duration.ofSeconds(1));
        List<SecurityIncident> escalated = service.escalateOverdueIncidents();

        assertEquals(1, escalated.size());
        assertEquals(critical.getId(), escalated.get(0).getId());
        assertTrue(service.getIncident(critical.getId()).isEscalated());
        assertEquals(IncidentState.NEW, service.getIncident(critical.getId()).getState());
        assertTrue(service.escalateOverdueIncidents().isEmpty());
        assertEquals(1, ctx.getAuditRepository().ofType(AuditEventTypes.INCIDENT_ESCALATED).size());
        assertEquals(1.0, ctx.getMeterRegistry().counter("business.incidents.escalated",
            "severity", "CRITICAL").count());
    }

    @Test
    void recovery_plan_and_report_describe_the_incident() {
        String id = service.createIncident(command(IncidentType.DATA_BREACH, IncidentSeverity.HIGH)
            .affectedSystem("records-db")
            .build()).getId();

        RecoveryPlan plan = service.generateRecoveryPlan(id);
        IncidentReport report = service.generateIncidentReport(id, "lead");

        assertEquals(id, plan.getIncidentId());
        assertFalse(plan.getSteps().isEmpty());
        assertTrue(plan.getEstimatedDurationMinutes() > 0);
        assertTrue(report.getReportId().startsWith("RPT-"));
        assertEquals(report.getReportId(), service.generateIncidentReport(id, "lead").getReportId());
        assertEquals(id, report.getSummary().incidentId());
        assertTrue(report.getImpact().dataExposureSuspected());
        assertEquals(2, ctx.getAuditRepository().ofType(AuditEventTypes.INCIDENT_REPORT_GENERATED).size());
    }

    @Test
    void listing_is_newest_first_and_filters_by_state() {
        String first = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.LOW).build()).getId();
        ctx.getClock().advance(Duration.ofMinutes(1));
        String second = service.createIncident(command(IncidentType.MALWARE, IncidentSeverity.LOW).build()).getId();
        service.updateIncidentState(first, IncidentState.TRIAGED, "ack", "analyst-7");

        assertEquals(List.of(second, first), service.listIncidents(null).stream()
            .map(SecurityIncident::getId).collect(Collectors.toList()));
        assertEquals(List.of(first), service.listIncidents(IncidentState.TRIAGED).stream()
            .map(SecurityIncident::getId).collect(Collectors.toList()));
    }

    private String triagedIncident(IncidentType type) {
        String id = service.createIncident(command(type, IncidentSeverity.HIGH).build()).getId();
        service.updateIncidentState(id, IncidentState.TRIAGED, "confirmed", "analyst-7");
        return id;
    }

    private static CreateIncidentCommand.CreateIncidentCommandBuilder command(IncidentType type,
                                                                               IncidentSeverity severity) {
        return CreateIncidentCommand.builder()
            .type(type)
            .severity(severity)
            .description("Reported by the records team")
            .detectionMethod(DetectionMethod.MANUAL)
            .createdBy("analyst-7");
    }
}
