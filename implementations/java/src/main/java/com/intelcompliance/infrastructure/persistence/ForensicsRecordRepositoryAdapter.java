package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.ForensicsRecord;
import com.intelcompliance.domain.repository.ForensicsRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@Transactional
@RequiredArgsConstructor
public class ForensicsRecordRepositoryAdapter implements ForensicsRecordRepository {

    private final SpringDataForensicsRecordRepository springDataRepository;

    @Override
    public ForensicsRecord save(ForensicsRecord record) {
        return springDataRepository.saveAndFlush(record);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ForensicsRecord> findById(UUID id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ForensicsRecord> findByIncidentId(String incidentId) {
        return springDataRepository.findByIncidentIdOrderByCollectedAtAsc(incidentId);
    }
}
