package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.CryptoKey;
import com.intelcompliance.domain.model.KeyPurpose;
import com.intelcompliance.domain.model.KeyStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SpringDataCryptoKeyRepository extends JpaRepository<CryptoKey, String> {

    List<CryptoKey> findByPurposeAndStatusOrderByKeyVersionDesc(KeyPurpose purpose, KeyStatus status);
}
