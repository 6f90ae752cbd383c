package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.domain.model.KeyMetadata;
import com.intelcompliance.domain.model.KeyPurpose;

import java.util.List;
import java.util.Optional;

/**
 * Key management service contract.
 *
 * <p>Generates, stores, retrieves and rotates symmetric keys tagged by
 * purpose. Key material never leaves this service except as a
 * {@link KeyHandle} handed to the encryption engine.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface KeyManagementService {

    /**
     * Loads the persisted key set and bootstraps a key for every purpose
     * without one.
     *
     * @throws IllegalStateException if no usable root secret is configured or a
     *         stored key fails to unwrap; this is fatal for the process
     */
    void initialize();

    /**
     * Ensures an active key exists for {@code purpose} and returns its metadata.
     * Serialised per purpose: concurrent callers get the same key.
     */
    KeyMetadata generateKey(KeyPurpose purpose);

    /**
     * Returns material for a key by id. Retired keys resolve; revoked or
     * unknown ids throw {@link com.intelcompliance.domain.exception.KeyNotFoundException}.
     */
    KeyHandle getKey(String keyId);

    /**
     * The key currently used for new encryptions or signatures of a purpose.
     */
    KeyHandle activeKey(KeyPurpose purpose);

    /**
     * Retires the active key of {@code purpose} and activates a new one.
     */
    KeyMetadata rotateKey(KeyPurpose purpose, String reason);

    /**
     * Revokes a key. If it was active, a replacement is generated.
     */
    void revokeKey(String keyId, String reason);

    /**
     * Rotates every active key whose rotation date has passed.
     *
     * @return metadata of the newly activated keys
     */
    List<KeyMetadata> rotateDueKeys();

    Optional<KeyMetadata> findKeyMetadata(String keyId);

    KeyReport keyReport();
}
