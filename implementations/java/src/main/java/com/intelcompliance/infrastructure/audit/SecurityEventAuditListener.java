package com.intelcompliance.infrastructure.audit;

import com.intelcompliance.config.PerformanceConfiguration.BusinessMetrics;
import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.infrastructure.crypto.CryptoAuthenticationFailureEvent;
import com.intelcompliance.infrastructure.crypto.KeyLifecycleEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Writes crypto-layer notifications into the audit trail.
 *
 * <p>The crypto layer publishes events instead of calling the audit service,
 * since the audit service itself depends on crypto for signing.
 */
@Component
@RequiredArgsConstructor
public class SecurityEventAuditListener {

    static final String SYSTEM_ACTOR = "system";

    private final AuditService auditService;
    private final BusinessMetrics businessMetrics;

    @EventListener
    public void onKeyLifecycle(KeyLifecycleEvent event) {
        String eventType = switch (event.action()) {
            case CREATED -> AuditEventTypes.KEY_CREATED;
            case ROTATED -> AuditEventTypes.KEY_ROTATED;
            case REVOKED -> AuditEventTypes.KEY_REVOKED;
        };

        AuditEventCommand.AuditEventCommandBuilder command = AuditEventCommand.builder()
            .eventType(eventType)
            .action(event.action().name().toLowerCase(Locale.ROOT))
            .actorId(SYSTEM_ACTOR)
            .resourceType("crypto_key")
            .resourceId(event.keyId())
            .classification(DataClassification.SENSITIVE)
            .outcome(AuditOutcome.SUCCESS)
            .occurredAt(event.occurredAt())
            .metadataEntry("purpose", event.purpose().name());
        if (event.previousKeyId() != null) {
            command.metadataEntry("previousKeyId", event.previousKeyId());
        }
        if (event.reason() != null) {
            command.metadataEntry("reason", event.reason());
        }
        auditService.record(command.build());
    }

    @EventListener
    public void onAuthenticationFailure(CryptoAuthenticationFailureEvent event) {
        businessMetrics.recordAuthenticationFailure(event.operation());

        AuditEventCommand.AuditEventCommandBuilder command = AuditEventCommand.builder()
            .eventType(AuditEventTypes.CRYPTO_AUTHENTICATION_FAILURE)
            .action(event.operation())
            .actorId(SYSTEM_ACTOR)
            .resourceType("crypto_key")
            .resourceId(event.keyId())
            .classification(DataClassification.SENSITIVE)
            .outcome(AuditOutcome.FAILURE)
            .occurredAt(event.occurredAt())
            .metadataEntry("reason", event.reason());
        if (event.context() != null) {
            command.metadataEntry("context", event.context());
        }
        auditService.record(command.build());
    }
}
