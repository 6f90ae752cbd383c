package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.CryptoKey;
import com.intelcompliance.domain.model.KeyPurpose;
import com.intelcompliance.domain.model.KeyStatus;
import com.intelcompliance.domain.repository.CryptoKeyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class CryptoKeyRepositoryAdapter implements CryptoKeyRepository {

    private final SpringDataCryptoKeyRepository springDataRepository;

    @Override
    public CryptoKey save(CryptoKey key) {
        CryptoKey saved = springDataRepository.save(key);
        log.debug("Key record persisted: {}", saved);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CryptoKey> findById(String id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CryptoKey> findByPurposeAndStatus(KeyPurpose purpose, KeyStatus status) {
        return springDataRepository.findByPurposeAndStatusOrderByKeyVersionDesc(purpose, status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CryptoKey> findAll() {
        return springDataRepository.findAll();
    }
}
