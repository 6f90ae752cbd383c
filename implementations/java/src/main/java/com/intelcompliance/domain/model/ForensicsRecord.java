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
import java.util.UUID;

/**
 * Immutable evidence bundle captured for an incident.
 *
 * <p>The snapshot and log-extract documents are stored sealed (CJI tier). The
 * integrity signature covers their plaintext bytes, so verification happens
 * after unsealing.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Entity
@Immutable
@Table(name = "forensics_records", indexes = {
    @Index(name = "idx_forensics_incident", columnList = "incident_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class ForensicsRecord {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "incident_id", nullable = false, length = 32)
    private String incidentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "collection_type", nullable = false, length = 16)
    private ForensicsCollectionType collectionType;

    @Column(name = "source_descriptor", nullable = false, length = 512)
    private String sourceDescriptor;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "ciphertext", column = @Column(name = "snapshot_ciphertext", columnDefinition = "BYTEA")),
        @AttributeOverride(name = "nonce", column = @Column(name = "snapshot_nonce", columnDefinition = "BYTEA")),
        @AttributeOverride(name = "authTag", column = @Column(name = "snapshot_auth_tag", columnDefinition = "BYTEA")),
        @AttributeOverride(name = "keyId", column = @Column(name = "snapshot_key_id", length = 64)),
        @AttributeOverride(name = "classification", column = @Column(name = "snapshot_classification", length = 16)),
        @AttributeOverride(name = "algorithm", column = @Column(name = "snapshot_algorithm", length = 32)),
        @AttributeOverride(name = "context", column = @Column(name = "snapshot_context", length = 128))
    })
    private EncryptionEnvelope sealedSnapshots;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "ciphertext", column = @Column(name = "logs_ciphertext", columnDefinition = "BYTEA")),
        @AttributeOverride(name = "nonce", column = @Column(name = "logs_nonce", columnDefinition = "BYTEA")),
        @AttributeOverride(name = "authTag", column = @Column(name = "logs_auth_tag", columnDefinition = "BYTEA")),
        @AttributeOverride(name = "keyId", column = @Column(name = "logs_key_id", length = 64)),
        @AttributeOverride(name = "classification", column = @Column(name = "logs_classification", length = 16)),
        @AttributeOverride(name = "algorithm", column = @Column(name = "logs_algorithm", length = 32)),
        @AttributeOverride(name = "context", column = @Column(name = "logs_context", length = 128))
    })
    private EncryptionEnvelope sealedLogExtract;

    @Embedded
    private IntegritySignature signature;

    @Column(name = "snapshot_count", nullable = false)
    private int snapshotCount;

    @Column(name = "log_entry_count", nullable = false)
    private int logEntryCount;

    @Column(name = "collected_by", nullable = false, length = 128)
    private String collectedBy;

    @Column(name = "collected_at", nullable = false)
    private Instant collectedAt;

    @Builder
    private ForensicsRecord(UUID id, String incidentId, ForensicsCollectionType collectionType,
                            String sourceDescriptor, EncryptionEnvelope sealedSnapshots,
                            EncryptionEnvelope sealedLogExtract, IntegritySignature signature,
                            int snapshotCount, int logEntryCount, String collectedBy,
                            Instant collectedAt) {
        this.id = id;
        this.incidentId = incidentId;
        this.collectionType = collectionType;
        this.sourceDescriptor = sourceDescriptor;
        this.sealedSnapshots = sealedSnapshots;
        this.sealedLogExtract = sealedLogExtract;
        this.signature = signature;
        this.snapshotCount = snapshotCount;
        this.logEntryCount = logEntryCount;
        this.collectedBy = collectedBy;
        this.collectedAt = collectedAt;
    }
}
