package com.intelcompliance.domain.repository;

import com.intelcompliance.domain.model.ForensicsRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ForensicsRecordRepository {

    ForensicsRecord save(ForensicsRecord record);

    Optional<ForensicsRecord> findById(UUID id);

    List<ForensicsRecord> findByIncidentId(String incidentId);
}
