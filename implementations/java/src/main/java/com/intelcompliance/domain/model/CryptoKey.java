package com.intelcompliance.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * Managed symmetric key, persisted in wrapped form only.
 *
 * <p><strong>Security:</strong>
 * <ul>
 *   <li>Material is stored AES-256-GCM wrapped under the root key</li>
 *   <li>The unwrapped material never leaves the key management service</li>
 *   <li>Status only moves forward: ACTIVE → RETIRED → REVOKED</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Entity
@Table(name = "crypto_keys", indexes = {
    @Index(name = "idx_crypto_keys_purpose_status", columnList = "purpose, status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class CryptoKey {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, updatable = false, length = 32)
    private KeyPurpose purpose;

    @Column(name = "algorithm", nullable = false, updatable = false, length = 32)
    private String algorithm;

    @Column(name = "wrapped_material", nullable = false, updatable = false)
    private byte[] wrappedMaterial;

    @Column(name = "wrap_iv", nullable = false, updatable = false)
    private byte[] wrapIv;

    /** SHA-256 hex of the raw material, checked after unwrapping. */
    @Column(name = "fingerprint", nullable = false, updatable = false, length = 64)
    private String fingerprint;

    @Column(name = "key_version", nullable = false, updatable = false)
    private int keyVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private KeyStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "rotation_due_at", nullable = false)
    private Instant rotationDueAt;

    @Column(name = "retired_at")
    private Instant retiredAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "status_reason", length = 512)
    private String statusReason;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private CryptoKey(String id, KeyPurpose purpose, String algorithm, byte[] wrappedMaterial,
                      byte[] wrapIv, String fingerprint, int keyVersion,
                      Instant createdAt, Instant rotationDueAt) {
        this.id = id;
        this.purpose = purpose;
        this.algorithm = algorithm;
        this.wrappedMaterial = wrappedMaterial.clone();
        this.wrapIv = wrapIv.clone();
        this.fingerprint = fingerprint;
        this.keyVersion = keyVersion;
        this.status = KeyStatus.ACTIVE;
        this.createdAt = createdAt;
        this.rotationDueAt = rotationDueAt;
    }

    public static CryptoKey create(String id, KeyPurpose purpose, String algorithm,
                                   byte[] wrappedMaterial, byte[] wrapIv, String fingerprint,
                                   int keyVersion, Instant createdAt, Instant rotationDueAt) {
        Objects.requireNonNull(id, "Key id must not be null");
        Objects.requireNonNull(purpose, "Key purpose must not be null");
        Objects.requireNonNull(wrappedMaterial, "Wrapped material must not be null");
        Objects.requireNonNull(wrapIv, "Wrap IV must not be null");
        return new CryptoKey(id, purpose, algorithm, wrappedMaterial, wrapIv, fingerprint,
            keyVersion, createdAt, rotationDueAt);
    }

    public byte[] getWrappedMaterial() {
        return wrappedMaterial.clone();
    }

    public byte[] getWrapIv() {
        return wrapIv.clone();
    }

    public boolean isActive() {
        return status == KeyStatus.ACTIVE;
    }

    public boolean isRevoked() {
        return status == KeyStatus.REVOKED;
    }

    public boolean isRotationDue(Instant now) {
        return isActive() && !rotationDueAt.isAfter(now);
    }

    public void retire(Instant at, String reason) {
        if (status != KeyStatus.ACTIVE) {
            throw new IllegalStateException("Only an active key can be retired: " + id);
        }
        this.status = KeyStatus.RETIRED;
        this.retiredAt = at;
        this.statusReason = reason;
    }

    public void revoke(Instant at, String reason) {
        if (status == KeyStatus.REVOKED) {
            return;
        }
        this.status = KeyStatus.REVOKED;
        this.revokedAt = at;
        this.statusReason = reason;
    }

    public KeyMetadata toMetadata() {
        return KeyMetadata.builder()
            .id(id)
            .purpose(purpose)
            .algorithm(algorithm)
            .status(status)
            .keyVersion(keyVersion)
            .createdAt(createdAt)
            .rotationDueAt(rotationDueAt)
            .retiredAt(retiredAt)
            .fingerprint(fingerprint.substring(0, 16))
            .build();
    }

    @Override
    public String toString() {
        return "CryptoKey[id=" + id + ", purpose=" + purpose + ", status=" + status
            + ", version=" + keyVersion + "]";
    }
}
