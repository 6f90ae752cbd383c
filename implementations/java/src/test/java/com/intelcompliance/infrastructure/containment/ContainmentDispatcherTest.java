package com.intelcompliance.infrastructure.containment;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.ContainmentAction;
import com.intelcompliance.domain.model.ContainmentActionType;
import com.intelcompliance.domain.model.ContainmentOutcome;
import com.intelcompliance.domain.model.DetectionMethod;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.ResponderRole;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.support.ComplianceTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContainmentDispatcherTest {

    private ComplianceTestContext ctx;
    private ContainmentDispatcher dispatcher;
    private SecurityIncident incident;

    @BeforeEach
    void setUp() {
        ctx = new ComplianceTestContext();
        dispatcher = ctx.getContainmentDispatcher();
        incident = SecurityIncident.open("INC-20260302100000-AABBCCDD", IncidentType.UNAUTHORIZED_ACCESS,
            IncidentSeverity.HIGH, "Access from unknown host", DetectionMethod.MANUAL, "203.0.113.9",
            Set.of("records-db"), Set.of("jdoe"), EnumSet.of(ResponderRole.SECURITY_ANALYST), null,
            "analyst-7", ComplianceTestContext.START, ComplianceTestContext.START.plus(Duration.ofHours(1)));
    }

    @Test
    void blocks_ip_literal_for_configured_duration() {
        ContainmentAction action = dispatcher.dispatch(ContainmentActionType.BLOCK_NETWORK_ADDRESS,
            " 203.0.113.9 ", incident, "analyst-7");

        assertTrue(action.succeeded());
        assertEquals(ComplianceTestContext.START, action.getExecutedAt());
        NetworkAddressBlocker.BlockedAddress block = ctx.getNetworkBlocker().blockOf("203.0.113.9").orElseThrow();
        assertEquals(incident.getId(), block.incidentId());
        assertEquals(ComplianceTestContext.START.plus(Duration.ofHours(24)), block.expiresAt());
        assertFalse(ctx.getNetworkBlocker().isBlocked("203.0.113.10"));
    }

    @Test
    void ipv6_literal_is_normalised() {
        dispatcher.dispatch(ContainmentActionType.BLOCK_NETWORK_ADDRESS, "2001:db8::1", incident, "analyst-7");

        assertTrue(ctx.getNetworkBlocker().isBlocked("2001:0db8:0:0:0:0:0:1"));
    }

    @Test
    void host_name_is_refused_without_failing_the_caller() {
        ContainmentAction action = dispatcher.dispatch(ContainmentActionType.BLOCK_NETWORK_ADDRESS,
            "attacker.example.com", incident, "analyst-7");

        assertEquals(ContainmentOutcome.FAILED, action.getOutcome());
        assertTrue(action.getDetail().contains("Not an IP address literal"));
        assertFalse(ctx.getNetworkBlocker().isBlocked("attacker.example.com"));
    }

    @Test
    void isolation_is_idempotent() {
        ContainmentAction first = dispatcher.dispatch(ContainmentActionType.ISOLATE_SYSTEM, "records-db",
            incident, "analyst-7");
        ContainmentAction second = dispatcher.dispatch(ContainmentActionType.ISOLATE_SYSTEM, "records-db",
            incident, "analyst-7");

        assertTrue(first.succeeded());
        assertTrue(second.succeeded());
        assertTrue(second.getDetail().contains("already isolated"));
        assertTrue(ctx.getIsolation().isIsolated("records-db"));
        assertTrue(ctx.getIsolation().release("records-db"));
        assertFalse(ctx.getIsolation().isIsolated("records-db"));
    }

    @Test
    void isolation_without_target_fails() {
        ContainmentAction action = dispatcher.dispatch(ContainmentActionType.ISOLATE_SYSTEM, " ",
            incident, "analyst-7");

        assertFalse(action.succeeded());
    }

    @Test
    void account_actions_are_requested_through_the_audit_trail() {
        ContainmentAction action = dispatcher.dispatch(ContainmentActionType.DISABLE_ACCOUNT, "jdoe",
            incident, "analyst-7");

        assertTrue(action.succeeded());
        List<AuditEvent> requests = ctx.getAuditRepository().ofType(AuditEventTypes.CONTAINMENT_REQUESTED);
        assertEquals(1, requests.size());
        assertEquals("disable_account", requests.get(0).getAction());
        assertEquals("jdoe", requests.get(0).getResourceId());
        assertEquals(incident.getId(), ctx.getAudit().metadataOf(requests.get(0)).get("incidentId"));
    }

    @Test
    void evidence_backup_links_forensics_record() {
        ContainmentAction action = dispatcher.dispatch(ContainmentActionType.BACKUP_EVIDENCE, null,
            incident, "analyst-7");

        assertTrue(action.succeeded());
        assertEquals(1, incident.getForensicRecordIds().size());
        assertEquals(1, ctx.getForensicsRepository().findByIncidentId(incident.getId()).size());
    }

    @Test
    void missing_executor_is_aFailed_action() {
        ContainmentDispatcher empty = new ContainmentDispatcher(List.of(), ctx.getClock());

        ContainmentAction action = empty.dispatch(ContainmentActionType.ISOLATE_SYSTEM, "records-db",
            incident, "analyst-7");

        assertEquals(ContainmentOutcome.FAILED, action.getOutcome());
        assertTrue(action.getDetail().startsWith("No executor"));
    }

    @Test
    void unexpected_executor_error_is_contained() {
        ContainmentExecutor broken = new ContainmentExecutor() {
            @Override
            public boolean supports(ContainmentActionType type) {
                return true;
            }

            @Override
            public String execute(ContainmentActionType type, String target, SecurityIncident incident,
                                  String actor) {
                throw new IllegalStateException("gateway timeout");
            }
        };
        ContainmentDispatcher dispatcherWithBrokenExecutor = new ContainmentDispatcher(List.of(broken),
            ctx.getClock());

        ContainmentAction action = dispatcherWithBrokenExecutor.dispatch(ContainmentActionType.TERMINATE_SESSIONS,
            "jdoe", incident, "analyst-7");

        assertEquals(ContainmentOutcome.FAILED, action.getOutcome());
        assertEquals("Unexpected failure: IllegalStateException", action.getDetail());
    }
}
