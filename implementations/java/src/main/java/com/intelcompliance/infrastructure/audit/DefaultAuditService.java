package com.intelcompliance.infrastructure.audit;

import com.intelcompliance.config.PerformanceConfiguration.BusinessMetrics;
import com.intelcompliance.domain.exception.AuditPersistenceException;
import com.intelcompliance.domain.exception.AuthenticationFailureException;
import com.intelcompliance.domain.exception.KeyNotFoundException;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.exception.ValidationException.Violation;
import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.EncryptionEnvelope;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.domain.repository.AuditEventRepository;
import com.intelcompliance.infrastructure.crypto.CryptoService;
import com.intelcompliance.infrastructure.serialization.CanonicalJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Signed, append-only audit trail.
 *
 * <p>Pipeline per event: validate, canonicalise metadata, seal metadata for
 * the CJI tier, sign, append. Any persistence failure is an audit loss and
 * propagates to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultAuditService implements AuditService {

    static final String METADATA_CONTEXT = "audit.metadata";

    private static final int MAX_EVENT_TYPE = 64;
    private static final int MAX_ACTION = 128;
    private static final int MAX_ACTOR = 128;
    private static final int MAX_RESOURCE_TYPE = 64;
    private static final int MAX_RESOURCE_ID = 256;
    private static final int MAX_ORIGIN = 64;
    private static final int MAX_CLIENT_DESCRIPTOR = 512;

    private final AuditEventRepository repository;
    private final CryptoService cryptoService;
    private final BusinessMetrics businessMetrics;
    private final Clock clock;

    @Override
    public AuditEvent record(AuditEventCommand command) {
        validate(command);

        String canonicalMetadata;
        try {
            canonicalMetadata = CanonicalJson.canonicalize(command.getMetadata());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("metadata", "is not serializable as JSON");
        }

        Instant occurredAt = Optional.ofNullable(command.getOccurredAt())
            .orElseGet(clock::instant)
            .truncatedTo(ChronoUnit.MILLIS);

        AuditEvent.AuditEventBuilder builder = AuditEvent.builder()
            .id(UUID.randomUUID())
            .eventType(command.getEventType())
            .action(command.getAction())
            .actorId(command.getActorId())
            .resourceType(command.getResourceType())
            .resourceId(command.getResourceId())
            .classification(command.getClassification())
            .outcome(command.getOutcome())
            .originAddress(command.getOriginAddress())
            .clientDescriptor(command.getClientDescriptor())
            .occurredAt(occurredAt);

        if (command.getClassification() == DataClassification.CJI) {
            builder.sealedMetadata(cryptoService.encrypt(canonicalMetadata, DataClassification.CJI, METADATA_CONTEXT));
        } else {
            builder.metadataJson(canonicalMetadata);
        }

        AuditEvent unsigned = builder.build();
        AuditEvent signed = unsigned.withSignature(cryptoService.generateIntegritySignature(
            CanonicalJson.bytes(unsigned.signedFields(canonicalMetadata))));

        AuditEvent stored;
        try {
            stored = repository.append(signed);
        } catch (RuntimeException e) {
            log.error("AUDIT LOSS type={} action={} actor={} id={}",
                command.getEventType(), command.getAction(), command.getActorId(), signed.getId(), e);
            throw new AuditPersistenceException("Failed to persist audit event " + signed.getId(), e);
        }

        businessMetrics.recordAuditEvent(stored.getOutcome().name());
        if (log.isInfoEnabled()) {
            log.info("AUDIT type={} action={} actor={} resource={}:{} outcome={} classification={}",
                stored.getEventType(), stored.getAction(), stored.getActorId(),
                stored.getResourceType(), stored.getResourceId(), stored.getOutcome(),
                stored.getClassification());
        }
        return stored;
    }

    @Override
    public List<AuditEvent> queryWindow(AuditEventFilter filter, TimeWindow window) {
        AuditEventFilter effective = filter != null ? filter : AuditEventFilter.ALL;
        return repository.findInWindow(window, effective.getEventTypes()).stream()
            .filter(effective::matches)
            .collect(Collectors.toList());
    }

    @Override
    public Map<String, Object> metadataOf(AuditEvent event) {
        return CanonicalJson.readMap(canonicalMetadataOf(event));
    }

    @Override
    public AuditVerificationResult verifyIntegrity(TimeWindow window) {
        List<AuditEvent> events = repository.findInWindow(window, List.of());
        List<UUID> failed = new ArrayList<>();

        for (AuditEvent event : events) {
            if (!signatureValid(event, true)) {
                failed.add(event.getId());
                log.error("SECURITY ALERT: audit event {} failed integrity verification", event.getId());
            }
        }

        if (!failed.isEmpty()) {
            log.error("SECURITY ALERT: {} of {} audit events in [{}, {}) failed verification",
                failed.size(), events.size(), window.from(), window.to());
        }
        return verificationResult(events.size(), failed);
    }

    @Override
    public AuditVerificationResult inspectIntegrity(TimeWindow window) {
        List<AuditEvent> events = repository.findInWindow(window, List.of());
        List<UUID> failed = new ArrayList<>();
        for (AuditEvent event : events) {
            if (!signatureValid(event, false)) {
                failed.add(event.getId());
            }
        }
        log.debug("Inspected {} audit events in [{}, {}), {} failed",
            events.size(), window.from(), window.to(), failed.size());
        return verificationResult(events.size(), failed);
    }

    private AuditVerificationResult verificationResult(int totalRecords, List<UUID> failed) {
        return AuditVerificationResult.builder()
            .verified(failed.isEmpty())
            .totalRecords(totalRecords)
            .failedRecordIds(List.copyOf(failed))
            .verifiedAt(clock.instant())
            .build();
    }

    /**
     * True when the stored signature matches the event's canonical payload.
     * Metadata that no longer decrypts counts as tampering. Failures are
     * published only when {@code report} is set.
     */
    boolean signatureValid(AuditEvent event, boolean report) {
        if (event.getSignature() == null) {
            return false;
        }
        String canonicalMetadata;
        try {
            canonicalMetadata = canonicalMetadataOf(event, report);
        } catch (AuthenticationFailureException | KeyNotFoundException e) {
            if (report) {
                log.warn("Audit event {} metadata could not be unsealed: {}", event.getId(), e.getMessage());
            }
            return false;
        }
        byte[] payload = CanonicalJson.bytes(event.signedFields(canonicalMetadata));
        return report
            ? cryptoService.verifyIntegrity(payload, event.getSignature())
            : cryptoService.checkIntegrity(payload, event.getSignature());
    }

    private String canonicalMetadataOf(AuditEvent event) {
        return canonicalMetadataOf(event, true);
    }

    private String canonicalMetadataOf(AuditEvent event, boolean report) {
        EncryptionEnvelope sealed = event.getSealedMetadata();
        if (sealed != null) {
            return report
                ? cryptoService.decryptToString(sealed, METADATA_CONTEXT)
                : new String(cryptoService.decryptUnreported(sealed, METADATA_CONTEXT), StandardCharsets.UTF_8);
        }
        return event.getMetadataJson() != null ? event.getMetadataJson() : CanonicalJson.canonicalize(null);
    }

    private static void validate(AuditEventCommand command) {
        if (command == null) {
            throw new ValidationException("command", "must not be null");
        }
        List<Violation> violations = new ArrayList<>();
        required(violations, "eventType", command.getEventType(), MAX_EVENT_TYPE);
        required(violations, "action", command.getAction(), MAX_ACTION);
        if (command.getClassification() == null) {
            violations.add(new Violation("classification", "must not be null"));
        }
        if (command.getOutcome() == null) {
            violations.add(new Violation("outcome", "must not be null"));
        }
        bounded(violations, "actorId", command.getActorId(), MAX_ACTOR);
        bounded(violations, "resourceType", command.getResourceType(), MAX_RESOURCE_TYPE);
        bounded(violations, "resourceId", command.getResourceId(), MAX_RESOURCE_ID);
        bounded(violations, "originAddress", command.getOriginAddress(), MAX_ORIGIN);
        bounded(violations, "clientDescriptor", command.getClientDescriptor(), MAX_CLIENT_DESCRIPTOR);

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private static void required(List<Violation> violations, String field, String value, int max) {
        if (value == null || value.isBlank()) {
            violations.add(new Violation(field, "must not be blank"));
        } else {
            bounded(violations, field, value, max);
        }
    }

    private static void bounded(List<Violation> violations, String field, String value, int max) {
        if (value != null && value.length() > max) {
            violations.add(new Violation(field, "exceeds " + max + " characters: "
                + Encode.forJava(value.substring(0, 32)) + "..."));
        }
    }
}
