package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.ForensicsRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SpringDataForensicsRecordRepository extends JpaRepository<ForensicsRecord, UUID> {

    List<ForensicsRecord> findByIncidentIdOrderByCollectedAtAsc(String incidentId);
}
