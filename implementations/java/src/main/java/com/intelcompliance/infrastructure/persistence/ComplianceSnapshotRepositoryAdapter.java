package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.ComplianceScoreSnapshot;
import com.intelcompliance.domain.repository.ComplianceSnapshotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@Transactional
@RequiredArgsConstructor
public class ComplianceSnapshotRepositoryAdapter implements ComplianceSnapshotRepository {

    private final SpringDataComplianceSnapshotRepository springDataRepository;

    @Override
    public ComplianceScoreSnapshot save(ComplianceScoreSnapshot snapshot) {
        return springDataRepository.save(snapshot);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ComplianceScoreSnapshot> findLatest() {
        return springDataRepository.findFirstByOrderByComputedAtDesc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ComplianceScoreSnapshot> findRecent(int limit) {
        return springDataRepository.findAllByOrderByComputedAtDesc(PageRequest.of(0, limit));
    }
}
