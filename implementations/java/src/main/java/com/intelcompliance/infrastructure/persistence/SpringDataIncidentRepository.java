package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.IncidentState;
import com.intelcompliance.domain.model.SecurityIncident;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface SpringDataIncidentRepository extends JpaRepository<SecurityIncident, String> {

    List<SecurityIncident> findByStateInOrderByCreatedAtDesc(Collection<IncidentState> states);

    @Query("SELECT i FROM SecurityIncident i WHERE i.createdAt >= :from AND i.createdAt < :to "
        + "ORDER BY i.createdAt ASC")
    List<SecurityIncident> findCreatedBetween(@Param("from") Instant from, @Param("to") Instant to);
}
