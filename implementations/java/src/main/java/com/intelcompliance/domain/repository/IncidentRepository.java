package com.intelcompliance.domain.repository;

import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.domain.model.TimeWindow;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the SecurityIncident aggregate. There is no delete.
 */
public interface IncidentRepository {

    SecurityIncident save(SecurityIncident incident);

    Optional<SecurityIncident> findById(String id);

    List<SecurityIncident> findAll();

    List<SecurityIncident> findByStates(Collection<IncidentState> states);

    List<SecurityIncident> findCreatedIn(TimeWindow window);
}
