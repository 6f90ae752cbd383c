package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.DetectionAlert;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface SpringDataDetectionAlertRepository extends JpaRepository<DetectionAlert, UUID> {

    boolean existsByDedupeKey(String dedupeKey);

    boolean existsByRuleIdAndGroupValueAndLastEventAtGreaterThanEqual(String ruleId, String groupValue,
                                                                        Instant lastEventAt);

    List<DetectionAlert> findByDetectedAtGreaterThanEqualOrderByDetectedAtDesc(Instant since, Pageable pageable);
}
