package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.ComplianceScoreSnapshot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SpringDataComplianceSnapshotRepository extends JpaRepository<ComplianceScoreSnapshot, UUID> {

    Optional<ComplianceScoreSnapshot> findFirstByOrderByComputedAtDesc();

    List<ComplianceScoreSnapshot> findAllByOrderByComputedAtDesc(Pageable pageable);
}
