package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.domain.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing the append-only audit store with Spring Data JPA.
 *
 * <p>{@link #append} flushes inside its own transaction so that a constraint
 * or connectivity failure reaches the caller instead of surfacing later at
 * commit time of an unrelated unit of work.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class AuditEventRepositoryAdapter implements AuditEventRepository {

    private final SpringDataAuditEventRepository springDataRepository;

    @Override
    public AuditEvent append(AuditEvent event) {
        if (springDataRepository.existsById(event.getId())) {
            throw new IllegalStateException("Audit event already exists: " + event.getId());
        }
        return springDataRepository.saveAndFlush(event);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuditEvent> findById(UUID id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEvent> findInWindow(TimeWindow window, Collection<String> eventTypes) {
        if (eventTypes == null || eventTypes.isEmpty()) {
            return springDataRepository.findInWindow(window.from(), window.to());
        }
        return springDataRepository.findInWindowByTypes(window.from(), window.to(), eventTypes);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEvent> findRecent(int limit) {
        return springDataRepository.findAllByOrderByOccurredAtDesc(PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public long countInWindow(TimeWindow window) {
        return springDataRepository.countInWindow(window.from(), window.to());
    }

    @Override
    @Transactional(readOnly = true)
    public long countInWindowByOutcome(TimeWindow window, AuditOutcome outcome) {
        return springDataRepository.countInWindowByOutcome(window.from(), window.to(), outcome);
    }

    @Override
    public int deleteOlderThan(DataClassification classification, Instant cutoff) {
        int removed = springDataRepository.deleteOlderThan(classification, cutoff);
        if (removed > 0) {
            log.warn("Audit retention purge removed {} {} events older than {}",
                removed, classification, cutoff);
        }
        return removed;
    }
}
