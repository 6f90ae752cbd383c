package com.intelcompliance.domain.model;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only record of a security-relevant action.
 *
 * <p>Rows are never updated. The only deletion path is the retention purge,
 * which removes rows older than their classification's retention period.
 *
 * <p><strong>Security:</strong>
 * <ul>
 *   <li>Signed over its canonical payload at record time</li>
 *   <li>CJI-tier metadata is stored encrypted; other tiers as canonical JSON</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Entity
@Immutable
@Table(name = "audit_events", indexes = {
    @Index(name = "idx_audit_events_occurred_at", columnList = "occurred_at"),
    @Index(name = "idx_audit_events_type_occurred_at", columnList = "event_type, occurred_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class AuditEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(name = "action", nullable = false, length = 128)
    private String action;

    @Column(name = "actor_id", length = 128)
    private String actorId;

    @Column(name = "resource_type", length = 64)
    private String resourceType;

    @Column(name = "resource_id", length = 256)
    private String resourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "classification", nullable = false, length = 16)
    private DataClassification classification;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16)
    private AuditOutcome outcome;

    @Column(name = "origin_address", length = 64)
    private String originAddress;

    @Column(name = "client_descriptor", length = 512)
    private String clientDescriptor;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    /** Canonical JSON; null when the metadata is sealed. */
    @Column(name = "metadata_json", columnDefinition = "TEXT")
    private String metadataJson;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "ciphertext", column = @Column(name = "metadata_ciphertext", columnDefinition = "BYTEA")),
        @AttributeOverride(name = "nonce", column = @Column(name = "metadata_nonce", columnDefinition = "BYTEA")),
        @AttributeOverride(name = "authTag", column = @Column(name = "metadata_auth_tag", columnDefinition = "BYTEA")),
        @AttributeOverride(name = "keyId", column = @Column(name = "metadata_key_id", length = 64)),
        @AttributeOverride(name = "classification", column = @Column(name = "metadata_classification", length = 16)),
        @AttributeOverride(name = "algorithm", column = @Column(name = "metadata_algorithm", length = 32)),
        @AttributeOverride(name = "context", column = @Column(name = "metadata_context", length = 128))
    })
    private EncryptionEnvelope sealedMetadata;

    @Embedded
    private IntegritySignature signature;

    @Builder
    private AuditEvent(UUID id, String eventType, String action, String actorId,
                       String resourceType, String resourceId, DataClassification classification,
                       AuditOutcome outcome, String originAddress, String clientDescriptor,
                       Instant occurredAt, String metadataJson, EncryptionEnvelope sealedMetadata,
                       IntegritySignature signature) {
        this.id = id;
        this.eventType = eventType;
        this.action = action;
        this.actorId = actorId;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.classification = classification;
        this.outcome = outcome;
        this.originAddress = originAddress;
        this.clientDescriptor = clientDescriptor;
        this.occurredAt = occurredAt;
        this.metadataJson = metadataJson;
        this.sealedMetadata = sealedMetadata;
        this.signature = signature;
    }

    public AuditEvent withSignature(IntegritySignature signature) {
        return new AuditEvent(id, eventType, action, actorId, resourceType, resourceId,
            classification, outcome, originAddress, clientDescriptor, occurredAt,
            metadataJson, sealedMetadata, signature);
    }

    public boolean isMetadataSealed() {
        return sealedMetadata != null;
    }

    public boolean isDenied() {
        return outcome == AuditOutcome.DENIED;
    }

    /**
     * Fields covered by the integrity signature, in a fixed order. The metadata
     * is always included in its plaintext canonical form, so sealing does not
     * change what is signed.
     *
     * @param canonicalMetadata canonical JSON of the metadata
     * @return ordered field map
     */
    public Map<String, Object> signedFields(String canonicalMetadata) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id.toString());
        fields.put("eventType", eventType);
        fields.put("action", action);
        fields.put("actorId", actorId);
        fields.put("resourceType", resourceType);
        fields.put("resourceId", resourceId);
        fields.put("classification", classification.name());
        fields.put("outcome", outcome.name());
        fields.put("originAddress", originAddress);
        fields.put("clientDescriptor", clientDescriptor);
        fields.put("occurredAt", occurredAt.toString());
        fields.put("metadata", canonicalMetadata);
        return fields;
    }

    @Override
    public String toString() {
        return "AuditEvent[id=" + id + ", type=" + eventType + ", action=" + action
            + ", outcome=" + outcome + ", classification=" + classification + "]";
    }
}
