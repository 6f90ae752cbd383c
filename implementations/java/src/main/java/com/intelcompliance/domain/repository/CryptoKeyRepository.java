package com.intelcompliance.domain.repository;

import com.intelcompliance.domain.model.CryptoKey;
import com.intelcompliance.domain.model.KeyPurpose;
import com.intelcompliance.domain.model.KeyStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for wrapped key records. Only the key management service
 * talks to this repository.
 */
public interface CryptoKeyRepository {

    CryptoKey save(CryptoKey key);

    Optional<CryptoKey> findById(String id);

    List<CryptoKey> findByPurposeAndStatus(KeyPurpose purpose, KeyStatus status);

    List<CryptoKey> findAll();
}
