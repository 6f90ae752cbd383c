package com.intelcompliance.domain.repository;

import com.intelcompliance.domain.model.ComplianceScoreSnapshot;

import java.util.List;
import java.util.Optional;

public interface ComplianceSnapshotRepository {

    ComplianceScoreSnapshot save(ComplianceScoreSnapshot snapshot);

    Optional<ComplianceScoreSnapshot> findLatest();

    /**
     * Newest first.
     */
    List<ComplianceScoreSnapshot> findRecent(int limit);
}
