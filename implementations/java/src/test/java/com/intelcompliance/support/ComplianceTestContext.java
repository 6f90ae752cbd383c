package com.intelcompliance.support;

import com.intelcompliance.application.compliance.ComplianceScoringService;
import com.intelcompliance.application.compliance.ObligationTracker;
import com.intelcompliance.application.compliance.ObligationTracker.TrackedObligation;
import com.intelcompliance.application.dashboard.SecurityDashboardService;
import com.intelcompliance.application.incident.IncidentIdGenerator;
import com.intelcompliance.application.incident.IncidentLocks;
import com.intelcompliance.application.incident.IncidentPatternSweep;
import com.intelcompliance.application.incident.IncidentReportAssembler;
import com.intelcompliance.application.incident.IncidentResponseService;
import com.intelcompliance.application.incident.RecoveryPlanner;
import com.intelcompliance.config.CacheConfiguration;
import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.config.PerformanceConfiguration.BusinessMetrics;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.infrastructure.audit.AuditEventCommand;
import com.intelcompliance.infrastructure.audit.AuditRetentionPurger;
import com.intelcompliance.infrastructure.audit.DefaultAuditService;
import com.intelcompliance.infrastructure.audit.SecurityEventAuditListener;
import com.intelcompliance.infrastructure.containment.AccountContainmentExecutor;
import com.intelcompliance.infrastructure.containment.AuditLoggingAccessControlGateway;
import com.intelcompliance.infrastructure.containment.ContainmentDispatcher;
import com.intelcompliance.infrastructure.containment.EvidenceBackupExecutor;
import com.intelcompliance.infrastructure.containment.NetworkAddressBlocker;
import com.intelcompliance.infrastructure.containment.SystemIsolationExecutor;
import com.intelcompliance.infrastructure.crypto.AesGcmCryptoService;
import com.intelcompliance.infrastructure.crypto.CryptoAuthenticationFailureEvent;
import com.intelcompliance.infrastructure.crypto.KeyLifecycleEvent;
import com.intelcompliance.infrastructure.crypto.PersistentKeyManagementService;
import com.intelcompliance.infrastructure.detection.PatternDetector;
import com.intelcompliance.infrastructure.forensics.AuditTrailSystemStateProvider;
import com.intelcompliance.infrastructure.forensics.ForensicsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The compliance core wired by hand over in-memory repositories and a
 * {@link MutableClock}, the way the application context wires it.
 */
@Getter
public class ComplianceTestContext {

    public static final Instant START = Instant.parse("2026-03-02T10:00:00Z");
    public static final String ROOT_SECRET = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

    private final MutableClock clock = new MutableClock(START);
    private final ComplianceProperties properties = new ComplianceProperties();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final BusinessMetrics businessMetrics = new BusinessMetrics(meterRegistry);

    private final InMemoryAuditEventRepository auditRepository = new InMemoryAuditEventRepository();
    private final InMemoryIncidentRepository incidentRepository = new InMemoryIncidentRepository();
    private final InMemoryCryptoKeyRepository keyRepository = new InMemoryCryptoKeyRepository();
    private final InMemoryForensicsRecordRepository forensicsRepository = new InMemoryForensicsRecordRepository();
    private final InMemoryDetectionAlertRepository alertRepository = new InMemoryDetectionAlertRepository();
    private final InMemoryComplianceSnapshotRepository snapshotRepository = new InMemoryComplianceSnapshotRepository();

    private final List<Object> publishedEvents = new CopyOnWriteArrayList<>();
    private final List<TrackedObligation> obligations = new CopyOnWriteArrayList<>();

    private final PersistentKeyManagementService keyManagement;
    private final AesGcmCryptoService crypto;
    private final DefaultAuditService audit;
    private final SecurityEventAuditListener securityEventListener;
    private final AuditRetentionPurger retentionPurger;
    private final SystemIsolationExecutor isolation;
    private final NetworkAddressBlocker networkBlocker;
    private final ForensicsCollector forensicsCollector;
    private final ContainmentDispatcher containmentDispatcher;
    private final IncidentResponseService incidentService;
    private final PatternDetector patternDetector;
    private final IncidentPatternSweep patternSweep;
    private final ComplianceScoringService scoringService;
    private final SecurityDashboardService dashboardService;

    public ComplianceTestContext() {
        properties.getCrypto().setRootSecret(ROOT_SECRET);
        properties.getCrypto().setSearchHashSalt("test-search-salt");

        keyManagement = new PersistentKeyManagementService(keyRepository, properties,
            new CacheConfiguration().cacheManager(), this::publish, clock);
        keyManagement.initialize();
        crypto = new AesGcmCryptoService(keyManagement, properties, this::publish, clock);
        audit = new DefaultAuditService(auditRepository, crypto, businessMetrics, clock);
        securityEventListener = new SecurityEventAuditListener(audit, businessMetrics);
        retentionPurger = new AuditRetentionPurger(auditRepository, audit, properties, clock);

        isolation = new SystemIsolationExecutor(clock);
        networkBlocker = new NetworkAddressBlocker(properties, clock);
        forensicsCollector = new ForensicsCollector(audit,
            new AuditTrailSystemStateProvider(audit, isolation, clock),
            crypto, forensicsRepository, properties, clock);
        containmentDispatcher = new ContainmentDispatcher(List.of(
            isolation,
            networkBlocker,
            new AccountContainmentExecutor(new AuditLoggingAccessControlGateway(audit)),
            new EvidenceBackupExecutor(forensicsCollector, clock)), clock);

        incidentService = new IncidentResponseService(incidentRepository, forensicsRepository, audit,
            containmentDispatcher, forensicsCollector, new RecoveryPlanner(), new IncidentReportAssembler(),
            new IncidentLocks(), new IncidentIdGenerator(), properties, businessMetrics, clock);
        patternDetector = new PatternDetector(audit);
        patternSweep = new IncidentPatternSweep(patternDetector, alertRepository, incidentService,
            properties, clock);

        ObligationTracker tracker = () -> List.copyOf(obligations);
        scoringService = new ComplianceScoringService(audit, incidentRepository, keyManagement, tracker,
            snapshotRepository, properties, clock);
        dashboardService = new SecurityDashboardService(auditRepository, incidentRepository, alertRepository,
            snapshotRepository, clock);
    }

    /**
     * Records an event the way an upstream component would report it.
     */
    public AuditEvent record(String eventType, String action, String actor, String origin,
                             AuditOutcome outcome, DataClassification classification) {
        return audit.record(AuditEventCommand.builder()
            .eventType(eventType)
            .action(action)
            .actorId(actor)
            .originAddress(origin)
            .classification(classification)
            .outcome(outcome)
            .build());
    }

    public <T> List<T> publishedEventsOf(Class<T> type) {
        List<T> matching = new CopyOnWriteArrayList<>();
        for (Object event : publishedEvents) {
            if (type.isInstance(event)) {
                matching.add(type.cast(event));
            }
        }
        return matching;
    }

    private void publish(Object event) {
        publishedEvents.add(event);
        // Key events during bootstrap arrive before the listener exists
        SecurityEventAuditListener listener = this.securityEventListener;
        if (listener == null) {
            return;
        }
        if (event instanceof KeyLifecycleEvent) {
            listener.onKeyLifecycle((KeyLifecycleEvent) event);
        } else if (event instanceof CryptoAuthenticationFailureEvent) {
            listener.onAuthenticationFailure((CryptoAuthenticationFailureEvent) event);
        }
    }
}
