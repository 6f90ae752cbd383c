package com.intelcompliance.infrastructure.forensics;

import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.ForensicsCollectionType;
import com.intelcompliance.domain.model.ForensicsRecord;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.domain.repository.ForensicsRecordRepository;
import com.intelcompliance.infrastructure.audit.AuditEventFilter;
import com.intelcompliance.infrastructure.audit.AuditService;
import com.intelcompliance.infrastructure.crypto.CryptoService;
import com.intelcompliance.infrastructure.serialization.CanonicalJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Collects, signs and seals forensic evidence for an incident.
 *
 * <p>Evidence handling:
 * <ul>
 *   <li>Snapshot and log extract are serialised to canonical JSON once</li>
 *   <li>Both are signed together, so neither can be swapped independently</li>
 *   <li>Both are stored encrypted at the CJI tier</li>
 *   <li>Unsealing returns the exact bytes that were signed</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ForensicsCollector {

    static final String SNAPSHOT_CONTEXT = "forensics.snapshot";
    static final String LOG_EXTRACT_CONTEXT = "forensics.log-extract";
    private static final int MAX_SOURCE_DESCRIPTOR = 512;

    private final AuditService auditService;
    private final SystemStateProvider systemStateProvider;
    private final CryptoService cryptoService;
    private final ForensicsRecordRepository repository;
    private final ComplianceProperties properties;
    private final Clock clock;

    /**
     * Collects evidence and persists the sealed record. Linking the record to
     * the incident is the caller's responsibility.
     */
    public ForensicsRecord collect(SecurityIncident incident, ForensicsCollectionType type,
                                   String sourceDescriptor, String actor) {
        if (type == null) {
            throw new ValidationException("collectionType", "must not be null");
        }
        String source = sourceDescriptor == null || sourceDescriptor.isBlank()
            ? "incident:" + incident.getId() : sourceDescriptor.trim();
        if (source.length() > MAX_SOURCE_DESCRIPTOR) {
            throw new ValidationException("source", "exceeds " + MAX_SOURCE_DESCRIPTOR + " characters");
        }

        Instant now = clock.instant();
        TimeWindow window = TimeWindow.through(now, properties.getIncident().getForensicsLookback());
        List<AuditEvent> windowEvents = auditService.queryWindow(AuditEventFilter.ALL, window);

        Map<String, Object> snapshots = new LinkedHashMap<>();
        int snapshotCount = 0;
        if (type != ForensicsCollectionType.LOG_EXTRACT) {
            List<Map<String, Object>> systems = new ArrayList<>();
            for (String systemId : incident.getAffectedSystems()) {
                systems.add(systemStateProvider.capture(systemId, window));
            }
            snapshotCount = systems.size();
            snapshots.put("systems", systems);
            snapshots.put("network", networkContext(incident, windowEvents));
        }

        List<Map<String, Object>> logExtract = type == ForensicsCollectionType.SYSTEM_STATE
            ? List.of() : logExtract(incident, windowEvents);

        String snapshotsJson = CanonicalJson.write(snapshots);
        String logExtractJson = CanonicalJson.write(logExtract);

        ForensicsRecord record = ForensicsRecord.builder()
            .id(UUID.randomUUID())
            .incidentId(incident.getId())
            .collectionType(type)
            .sourceDescriptor(source)
            .sealedSnapshots(cryptoService.encrypt(snapshotsJson, DataClassification.CJI, SNAPSHOT_CONTEXT))
            .sealedLogExtract(cryptoService.encrypt(logExtractJson, DataClassification.CJI, LOG_EXTRACT_CONTEXT))
            .signature(cryptoService.generateIntegritySignature(signedPayload(snapshotsJson, logExtractJson)))
            .snapshotCount(snapshotCount)
            .logEntryCount(logExtract.size())
            .collectedBy(actor)
            .collectedAt(now)
            .build();

        ForensicsRecord saved = repository.save(record);
        log.info("INCIDENT {} forensics {} collected: {} snapshots, {} log entries",
            incident.getId(), saved.getId(), snapshotCount, logExtract.size());
        return saved;
    }

    public ForensicsContents unseal(ForensicsRecord record) {
        String snapshotsJson = cryptoService.decryptToString(record.getSealedSnapshots(), SNAPSHOT_CONTEXT);
        String logExtractJson = cryptoService.decryptToString(record.getSealedLogExtract(), LOG_EXTRACT_CONTEXT);
        boolean valid = cryptoService.verifyIntegrity(
            signedPayload(snapshotsJson, logExtractJson), record.getSignature());
        if (!valid) {
            log.error("SECURITY ALERT: forensics record {} failed signature verification", record.getId());
        }
        return new ForensicsContents(snapshotsJson, logExtractJson, valid);
    }

    private static byte[] signedPayload(String snapshotsJson, String logExtractJson) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("logExtract", logExtractJson);
        payload.put("snapshots", snapshotsJson);
        return CanonicalJson.bytes(payload);
    }

    /**
     * Denied, failed or CJI events touching the incident's systems, users or
     * origin. An incident with no scope at all takes every such event.
     * Most recent entries are kept when the cap applies.
     */
    private List<Map<String, Object>> logExtract(SecurityIncident incident, List<AuditEvent> events) {
        boolean unscoped = incident.getAffectedSystems().isEmpty()
            && incident.getAffectedUsers().isEmpty()
            && incident.getSourceAddress() == null;
        int cap = properties.getIncident().getForensicsMaxLogEntries();

        return events.stream()
            .filter(e -> e.isDenied() || e.getOutcome() == AuditOutcome.FAILURE
                || e.getClassification() == DataClassification.CJI)
            .filter(e -> unscoped || relatesTo(incident, e))
            .sorted(Comparator.comparing(AuditEvent::getOccurredAt).reversed())
            .limit(cap)
            .sorted(Comparator.comparing(AuditEvent::getOccurredAt))
            .map(ForensicsCollector::logEntry)
            .collect(Collectors.toList());
    }

    private static boolean relatesTo(SecurityIncident incident, AuditEvent event) {
        return (event.getResourceId() != null && incident.getAffectedSystems().contains(event.getResourceId()))
            || (event.getActorId() != null && incident.getAffectedUsers().contains(event.getActorId()))
            || (incident.getSourceAddress() != null && incident.getSourceAddress().equals(event.getOriginAddress()));
    }

    private static Map<String, Object> logEntry(AuditEvent event) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", event.getId().toString());
        entry.put("occurredAt", event.getOccurredAt().toString());
        entry.put("eventType", event.getEventType());
        entry.put("action", event.getAction());
        entry.put("actorId", event.getActorId());
        entry.put("resourceType", event.getResourceType());
        entry.put("resourceId", event.getResourceId());
        entry.put("outcome", event.getOutcome().name());
        entry.put("classification", event.getClassification().name());
        entry.put("originAddress", event.getOriginAddress());
        return entry;
    }

    private static Map<String, Object> networkContext(SecurityIncident incident, List<AuditEvent> events) {
        Map<String, Object> network = new LinkedHashMap<>();
        String source = incident.getSourceAddress();
        network.put("sourceAddress", source);
        if (source == null) {
            network.put("eventCount", 0);
            return network;
        }
        List<AuditEvent> fromSource = events.stream()
            .filter(e -> source.equals(e.getOriginAddress()))
            .collect(Collectors.toList());
        network.put("eventCount", fromSource.size());
        network.put("eventsByType", new TreeMap<>(fromSource.stream()
            .collect(Collectors.groupingBy(AuditEvent::getEventType, Collectors.counting()))));
        network.put("actors", fromSource.stream()
            .map(AuditEvent::getActorId)
            .filter(a -> a != null)
            .distinct()
            .sorted()
            .collect(Collectors.toList()));
        network.put("firstSeen", fromSource.stream().map(AuditEvent::getOccurredAt)
            .min(Comparator.naturalOrder()).map(Instant::toString).orElse(null));
        network.put("lastSeen", fromSource.stream().map(AuditEvent::getOccurredAt)
            .max(Comparator.naturalOrder()).map(Instant::toString).orElse(null));
        return network;
    }
}
