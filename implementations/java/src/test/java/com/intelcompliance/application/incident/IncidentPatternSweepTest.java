package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.DetectionAlert;
import com.intelcompliance.domain.model.DetectionMethod;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentType;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.infrastructure.detection.DetectionMatch;
import com.intelcompliance.infrastructure.detection.DetectionRule;
import com.intelcompliance.infrastructure.detection.PatternDetector;
import com.intelcompliance.support.ComplianceTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IncidentPatternSweepTest {

    private ComplianceTestContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new ComplianceTestContext();
        ctx.getProperties().getDetection().getRules().add(bruteForce());
    }

    @Test
    void brute_force_opens_one_automated_incident() {
        failedLogins("10.0.0.1", 12);

        List<SecurityIncident> created = ctx.getPatternSweep().checkForIncidentPatterns();

        assertEquals(1, created.size());
        SecurityIncident incident = created.get(0);
        assertEquals(IncidentType.BRUTE_FORCE, incident.getType());
        assertEquals(IncidentSeverity.MEDIUM, incident.getSeverity());
        assertEquals(DetectionMethod.AUTOMATED, incident.getDetectionMethod());
        assertEquals("10.0.0.1", incident.getSourceAddress());
        assertEquals("system", incident.getCreatedBy());

        List<DetectionAlert> alerts = ctx.getAlertRepository().all();
        assertEquals(1, alerts.size());
        assertEquals(incident.getId(), alerts.get(0).getIncidentId());
        assertEquals(12, alerts.get(0).getAggregateValue());
        assertEquals("brute-force-login", alerts.get(0).getRuleId());
    }

    @Test
    void repeated_sweep_does_not_reopen_the_same_match() {
        failedLogins("10.0.0.1", 12);

        assertEquals(1, ctx.getPatternSweep().checkForIncidentPatterns().size());
        ctx.getClock().advance(Duration.ofSeconds(30));

        assertTrue(ctx.getPatternSweep().checkForIncidentPatterns().isEmpty());
        assertEquals(1, ctx.getIncidentRepository().findAll().size());
    }

    @Test
    void burst_straddling_a_window_boundary_is_raised_once() {
        ctx.getClock().set(ComplianceTestContext.START.minusSeconds(2));
        failedLogins("10.0.0.1", 1);
        ctx.getClock().set(ComplianceTestContext.START);
        failedLogins("10.0.0.1", 12);

        assertEquals(1, ctx.getPatternSweep().checkForIncidentPatterns().size());

        // The window now starts after the oldest event, so the match begins later.
        ctx.getClock().set(ComplianceTestContext.START.plus(Duration.ofMinutes(4)).plusSeconds(59));
        assertTrue(ctx.getPatternSweep().checkForIncidentPatterns().isEmpty());
        assertEquals(1, ctx.getIncidentRepository().findAll().size());
    }

    @Test
    void later_burst_after_the_window_clears_opens_a_new_incident() {
        failedLogins("10.0.0.1", 12);
        assertEquals(1, ctx.getPatternSweep().checkForIncidentPatterns().size());

        ctx.getClock().advance(Duration.ofMinutes(20));
        failedLogins("10.0.0.1", 12);

        assertEquals(1, ctx.getPatternSweep().checkForIncidentPatterns().size());
        assertEquals(2, ctx.getAlertRepository().all().size());
    }

    @Test
    void quiet_audit_trail_opens_nothing() {
        failedLogins("10.0.0.1", 10);

        assertTrue(ctx.getPatternSweep().checkForIncidentPatterns().isEmpty());
        assertTrue(ctx.getAlertRepository().all().isEmpty());
    }

    @Test
    void malformed_rule_is_skipped_and_others_still_run() {
        DetectionRule broken = DetectionRule.builder()
            .id("broken")
            .eventTypes(List.of(AuditEventTypes.LOGIN_FAILED))
            .groupBy(DetectionRule.GroupBy.ORIGIN_ADDRESS)
            .threshold(1)
            .window(Duration.ZERO)
            .incidentType(IncidentType.BRUTE_FORCE)
            .severity(IncidentSeverity.LOW)
            .build();
        ctx.getProperties().getDetection().getRules().add(0, broken);
        failedLogins("10.0.0.1", 12);

        assertEquals(1, ctx.getPatternSweep().checkForIncidentPatterns().size());
    }

    @Test
    void disabled_detection_skips_scheduled_sweep() {
        ctx.getProperties().getDetection().setEnabled(false);
        failedLogins("10.0.0.1", 12);

        ctx.getPatternSweep().scheduledSweep();

        assertTrue(ctx.getIncidentRepository().findAll().isEmpty());
    }

    @Test
    void overlapping_sweep_returns_immediately() throws Exception {
        failedLogins("10.0.0.1", 12);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PatternDetector blocking = new PatternDetector(ctx.getAudit()) {
            @Override
            public List<DetectionMatch> evaluate(DetectionRule rule, Instant now) {
                entered.countDown();
                try {
                    if (!release.await(10, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("sweep was never released");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return super.evaluate(rule, now);
            }
        };
        IncidentPatternSweep sweep = new IncidentPatternSweep(blocking, ctx.getAlertRepository(),
            ctx.getIncidentService(), ctx.getProperties(), ctx.getClock());

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<List<SecurityIncident>> first = pool.submit(sweep::checkForIncidentPatterns);
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            assertTrue(sweep.checkForIncidentPatterns().isEmpty());

            release.countDown();
            assertEquals(1, first.get(10, TimeUnit.SECONDS).size());
        } finally {
            release.countDown();
            pool.shutdown();
        }
    }

    private void failedLogins(String origin, int count) {
        for (int i = 0; i < count; i++) {
            ctx.record(AuditEventTypes.LOGIN_FAILED, "login", "jdoe", origin, AuditOutcome.FAILURE,
                DataClassification.PUBLIC);
            ctx.getClock().advance(Duration.ofSeconds(1));
        }
    }

    private static DetectionRule bruteForce() {
        return DetectionRule.builder()
            .id("brute-force-login")
            .eventTypes(List.of(AuditEventTypes.LOGIN_FAILED))
            .groupBy(DetectionRule.GroupBy.ORIGIN_ADDRESS)
            .threshold(10)
            .window(Duration.ofMinutes(5))
            .incidentType(IncidentType.BRUTE_FORCE)
            .severity(IncidentSeverity.MEDIUM)
            .build();
    }
}
