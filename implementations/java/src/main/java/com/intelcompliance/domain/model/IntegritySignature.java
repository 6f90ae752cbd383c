package com.intelcompliance.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Objects;

/**
 * Keyed signature over a byte sequence. Names the signing key so that
 * signatures made before a rotation still verify afterwards.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode
public final class IntegritySignature implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String HMAC_SHA256 = "HMAC-SHA256";

    @Column(name = "signature_key_id", length = 64)
    private String keyId;

    @Column(name = "signature_algorithm", length = 32)
    private String algorithm;

    /** Lower-case hex. */
    @Column(name = "signature_value", length = 128)
    private String value;

    public IntegritySignature(String keyId, String algorithm, String value) {
        this.keyId = Objects.requireNonNull(keyId, "Signature key id must not be null");
        this.algorithm = Objects.requireNonNull(algorithm, "Signature algorithm must not be null");
        this.value = Objects.requireNonNull(value, "Signature value must not be null");
    }

    @Override
    public String toString() {
        return "IntegritySignature[" + algorithm + ", key=" + keyId + "]";
    }
}
