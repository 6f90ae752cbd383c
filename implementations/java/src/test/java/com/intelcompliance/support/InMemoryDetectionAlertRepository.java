package com.intelcompliance.support;

import com.intelcompliance.domain.model.DetectionAlert;
import com.intelcompliance.domain.repository.DetectionAlertRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryDetectionAlertRepository implements DetectionAlertRepository {

    private final List<DetectionAlert> alerts = new CopyOnWriteArrayList<>();

    public List<DetectionAlert> all() {
        return new ArrayList<>(alerts);
    }

    @Override
    public boolean existsByDedupeKey(String dedupeKey) {
        return alerts.stream().anyMatch(a -> a.getDedupeKey().equals(dedupeKey));
    }

    @Override
    public boolean existsOverlapping(String ruleId, String groupValue, Instant eventsFrom) {
        return alerts.stream().anyMatch(a -> a.getRuleId().equals(ruleId)
            && Objects.equals(a.getGroupValue(), groupValue)
            && !a.getLastEventAt().isBefore(eventsFrom));
    }

    @Override
    public DetectionAlert save(DetectionAlert alert) {
        alerts.add(alert);
        return alert;
    }

    @Override
    public List<DetectionAlert> findDetectedSince(Instant since, int limit) {
        return alerts.stream()
            .filter(a -> !a.getDetectedAt().isBefore(since))
            .sorted(Comparator.comparing(DetectionAlert::getDetectedAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }
}
