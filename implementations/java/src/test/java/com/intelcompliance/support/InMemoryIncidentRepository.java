package com.intelcompliance.support;

import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.domain.repository.IncidentRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryIncidentRepository implements IncidentRepository {

    private final Map<String, SecurityIncident> incidents = new ConcurrentHashMap<>();

    @Override
    public SecurityIncident save(SecurityIncident incident) {
        incidents.put(incident.getId(), incident);
        return incident;
    }

    @Override
    public Optional<SecurityIncident> findById(String id) {
        return Optional.ofNullable(incidents.get(id));
    }

    @Override
    public List<SecurityIncident> findAll() {
        return new ArrayList<>(incidents.values());
    }

    @Override
    public List<SecurityIncident> findByStates(Collection<IncidentState> states) {
        return incidents.values().stream()
            .filter(i -> states.contains(i.getState()))
            .collect(Collectors.toList());
    }

    @Override
    public List<SecurityIncident> findCreatedIn(TimeWindow window) {
        return incidents.values().stream()
            .filter(i -> window.contains(i.getCreatedAt()))
            .collect(Collectors.toList());
    }
}
