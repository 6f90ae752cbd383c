package com.intelcompliance.application.dashboard;

import com.intelcompliance.application.incident.CreateIncidentCommand;
import com.intelcompliance.application.incident.IncidentResponseService;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.DetectionMethod;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.support.ComplianceTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SecurityDashboardServiceTest {

    private ComplianceTestContext ctx;
    private SecurityDashboardService dashboard;

    @BeforeEach
    void setUp() {
        ctx = new ComplianceTestContext();
        dashboard = ctx.getDashboardService();
    }

    @Test
    void empty_stores_give_zero_overview() {
        DashboardOverview overview = dashboard.overview();

        assertEquals(0, overview.getEventsToday());
        assertEquals(0, overview.getDeniedToday());
        assertEquals(0, overview.getActiveIncidents());
        assertTrue(overview.getRecentAlerts().isEmpty());
        assertTrue(overview.getRecentAuditEntries().isEmpty());
        assertNull(overview.getComplianceScores());
        assertEquals(ComplianceTestContext.START, overview.getGeneratedAt());
    }

    @Test
    void overview_counts_today_and_active_incidents() {
        ctx.record(AuditEventTypes.LOGIN_SUCCESS, "login", "jdoe", "10.0.0.1", AuditOutcome.SUCCESS,
            DataClassification.PUBLIC);
        ctx.getClock().advance(Duration.ofSeconds(1));
        ctx.record(AuditEventTypes.ACCESS_DENIED, "read", "jdoe", "10.0.0.1", AuditOutcome.DENIED,
            DataClassification.CJI);
        ctx.getClock().advance(Duration.ofSeconds(1));
        ctx.getIncidentService().createIncident(command(IncidentSeverity.CRITICAL));
        ctx.getScoringService().recordSnapshot();

        DashboardOverview overview = dashboard.overview();

        assertEquals(3, overview.getEventsToday());
        assertEquals(1, overview.getDeniedToday());
        assertEquals(1, overview.getActiveIncidents());
        assertEquals(1, overview.getCriticalIncidents());
        assertEquals(AuditEventTypes.INCIDENT_CREATED, overview.getRecentAuditEntries().get(0).eventType());
        assertNotNull(overview.getComplianceScores());
    }

    @Test
    void events_from_yesterday_are_not_counted_today() {
        ctx.record(AuditEventTypes.LOGIN_SUCCESS, "login", "jdoe", "10.0.0.1", AuditOutcome.SUCCESS,
            DataClassification.PUBLIC);
        ctx.getClock().advance(Duration.ofDays(1));

        DashboardOverview overview = dashboard.overview();

        assertEquals(0, overview.getEventsToday());
        assertEquals(1, overview.getRecentAuditEntries().size());
    }

    @Test
    void statistics_aggregate_incidents_in_period() {
        IncidentResponseService incidents = ctx.getIncidentService();
        String resolved = incidents.createIncident(command(IncidentSeverity.HIGH)).getId();
        incidents.createIncident(command(IncidentSeverity.LOW));
        for (IncidentState next : new IncidentState[] {IncidentState.TRIAGED, IncidentState.CONTAINED,
                IncidentState.INVESTIGATING, IncidentState.RECOVERING}) {
            incidents.updateIncidentState(resolved, next, "step", "analyst-7");
        }
        ctx.getClock().advance(Duration.ofMinutes(30));
        incidents.updateIncidentState(resolved, IncidentState.RESOLVED, "clean", "analyst-7");

        Instant start = ComplianceTestContext.START.minus(Duration.ofHours(1));
        IncidentStatistics stats = dashboard.incidentStatistics(start, ComplianceTestContext.START.plusSeconds(1));

        assertEquals(2, stats.getTotalIncidents());
        assertEquals(2L, stats.getByType().get(IncidentType.MALWARE));
        assertEquals(1L, stats.getBySeverity().get(IncidentSeverity.HIGH));
        assertEquals(1L, stats.getByState().get(IncidentState.RESOLVED));
        assertEquals(1L, stats.getByState().get(IncidentState.NEW));
        assertEquals(30.0, stats.getAverageTimeToResolveMinutes());
    }

    @Test
    void statistics_without_resolutions_have_no_average() {
        IncidentStatistics stats = dashboard.incidentStatistics(ComplianceTestContext.START,
            ComplianceTestContext.START.plus(Duration.ofDays(1)));

        assertEquals(0, stats.getTotalIncidents());
        assertTrue(stats.getByState().isEmpty());
        assertNull(stats.getAverageTimeToResolveMinutes());
        assertThrows(ValidationException.class, () -> dashboard.incidentStatistics(
            ComplianceTestContext.START, ComplianceTestContext.START.minusSeconds(1)));
    }

    private static CreateIncidentCommand command(IncidentSeverity severity) {
        return CreateIncidentCommand.builder()
            .type(IncidentType.MALWARE)
            .severity(severity)
            .description("Suspicious binary on workstation")
            .detectionMethod(DetectionMethod.MANUAL)
            .createdBy("analyst-7")
            .build();
    }
}
