package com.intelcompliance.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.owasp.encoder.Encode;

import java.io.Serializable;
import java.util.Base64;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Persisted form of an encrypted value.
 *
 * <p>Carries everything needed to decrypt and authenticate the value: the
 * ciphertext, nonce, authentication tag, the identifier of the key that
 * produced it, and the classification and context label bound into the
 * additional authenticated data.
 *
 * <p><strong>Security Guarantees:</strong>
 * <ul>
 *   <li>Immutable - cannot be modified after creation</li>
 *   <li>Key ID reference only (never the actual key)</li>
 *   <li>Context label is authenticated; decrypting under another label fails</li>
 *   <li>Byte arrays are copied in and out</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@EqualsAndHashCode
public final class EncryptionEnvelope implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String AES_256_GCM = "AES-256-GCM";

    private static final Pattern KEY_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");
    private static final Pattern CONTEXT_PATTERN = Pattern.compile("^[a-zA-Z0-9_.:-]{1,128}$");

    @Column(name = "ciphertext", columnDefinition = "BYTEA")
    private byte[] ciphertext;

    /** 96-bit GCM nonce. Never reused with the same key. */
    @Column(name = "nonce", columnDefinition = "BYTEA")
    private byte[] nonce;

    @Column(name = "auth_tag", columnDefinition = "BYTEA")
    private byte[] authTag;

    @Column(name = "key_id", length = 64)
    private String keyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "classification", length = 16)
    private DataClassification classification;

    @Column(name = "algorithm", length = 32)
    private String algorithm;

    @Column(name = "context_label", length = 128)
    private String context;

    public EncryptionEnvelope(
            byte[] ciphertext,
            byte[] nonce,
            byte[] authTag,
            String keyId,
            DataClassification classification,
            String algorithm,
            String context) {

        this.ciphertext = Objects.requireNonNull(ciphertext, "Ciphertext must not be null").clone();
        this.nonce = Objects.requireNonNull(nonce, "Nonce must not be null").clone();
        this.authTag = Objects.requireNonNull(authTag, "Auth tag must not be null").clone();
        this.keyId = validateKeyId(keyId);
        this.classification = Objects.requireNonNull(classification, "Classification must not be null");
        this.algorithm = Objects.requireNonNull(algorithm, "Algorithm must not be null");
        this.context = validateContext(context);

        if (AES_256_GCM.equals(algorithm) && nonce.length != 12) {
            throw new IllegalArgumentException("AES-256-GCM requires 12-byte nonce");
        }
        if (AES_256_GCM.equals(algorithm) && authTag.length != 16) {
            throw new IllegalArgumentException("AES-256-GCM requires 16-byte auth tag");
        }
    }

    public byte[] getCiphertext() {
        return ciphertext != null ? ciphertext.clone() : null;
    }

    public byte[] getNonce() {
        return nonce != null ? nonce.clone() : null;
    }

    public byte[] getAuthTag() {
        return authTag != null ? authTag.clone() : null;
    }

    /**
     * Validates a context label. Shared with the encryption engine so that
     * a label rejected here is rejected before any cipher work.
     *
     * @param context label identifying the field or use-site
     * @return the label
     * @throws IllegalArgumentException if blank or outside the allowed alphabet
     */
    public static String validateContext(String context) {
        if (context == null || context.isBlank()) {
            throw new IllegalArgumentException("Context label must not be blank");
        }
        if (!CONTEXT_PATTERN.matcher(context).matches()) {
            throw new IllegalArgumentException(
                "Invalid context label: " + Encode.forJava(context));
        }
        return context;
    }

    private static String validateKeyId(String keyId) {
        if (keyId == null || !KEY_ID_PATTERN.matcher(keyId).matches()) {
            throw new IllegalArgumentException(
                "Invalid key ID format: " + Encode.forJava(String.valueOf(keyId)));
        }
        return keyId;
    }

    @Override
    public String toString() {
        String encoded = Base64.getEncoder().encodeToString(ciphertext != null ? ciphertext : new byte[0]);
        String truncated = encoded.length() > 16 ? encoded.substring(0, 16) + "..." : encoded;

        return String.format(
            "EncryptionEnvelope[algorithm=%s, classification=%s, context=%s, keyId=%s, ciphertext=%s]",
            algorithm, classification, context, maskKeyId(keyId), truncated);
    }

    private static String maskKeyId(String keyId) {
        if (keyId == null || keyId.length() <= 4) {
            return "****";
        }
        return "****" + keyId.substring(keyId.length() - 4);
    }
}
