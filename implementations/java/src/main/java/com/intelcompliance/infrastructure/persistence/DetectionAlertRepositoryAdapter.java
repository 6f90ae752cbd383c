package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.DetectionAlert;
import com.intelcompliance.domain.repository.DetectionAlertRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Component
@Transactional
@RequiredArgsConstructor
public class DetectionAlertRepositoryAdapter implements DetectionAlertRepository {

    private final SpringDataDetectionAlertRepository springDataRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean existsByDedupeKey(String dedupeKey) {
        return springDataRepository.existsByDedupeKey(dedupeKey);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsOverlapping(String ruleId, String groupValue, Instant eventsFrom) {
        return springDataRepository.existsByRuleIdAndGroupValueAndLastEventAtGreaterThanEqual(
            ruleId, groupValue, eventsFrom);
    }

    @Override
    public DetectionAlert save(DetectionAlert alert) {
        return springDataRepository.saveAndFlush(alert);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DetectionAlert> findDetectedSince(Instant since, int limit) {
        return springDataRepository.findByDetectedAtGreaterThanEqualOrderByDetectedAtDesc(
            since, PageRequest.of(0, limit));
    }
}
