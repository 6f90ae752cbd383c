package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.domain.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing the incident repository with Spring Data JPA.
 *
 * <p>Saves flush immediately so that a version conflict from a concurrent
 * writer in another process is raised while the caller still holds the
 * incident lock.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class IncidentRepositoryAdapter implements IncidentRepository {

    private final SpringDataIncidentRepository springDataRepository;

    @Override
    public SecurityIncident save(SecurityIncident incident) {
        SecurityIncident saved = springDataRepository.saveAndFlush(incident);

        if (log.isDebugEnabled()) {
            log.debug("Incident persisted: id={}, state={}, version={}",
                saved.getId(), saved.getState(), saved.getVersion());
        }
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SecurityIncident> findById(String id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SecurityIncident> findAll() {
        return springDataRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<SecurityIncident> findByStates(Collection<IncidentState> states) {
        return springDataRepository.findByStateInOrderByCreatedAtDesc(states);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SecurityIncident> findCreatedIn(TimeWindow window) {
        return springDataRepository.findCreatedBetween(window.from(), window.to());
    }
}
