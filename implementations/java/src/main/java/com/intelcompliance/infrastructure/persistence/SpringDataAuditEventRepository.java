package com.intelcompliance.infrastructure.persistence;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for audit events.
 *
 * <p>Exposes inserts through {@code save} and reads only; the bulk delete is
 * reserved for retention purges.
 */
@Repository
public interface SpringDataAuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    @Query("SELECT e FROM AuditEvent e WHERE e.occurredAt >= :from AND e.occurredAt < :to "
        + "ORDER BY e.occurredAt ASC")
    List<AuditEvent> findInWindow(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT e FROM AuditEvent e WHERE e.occurredAt >= :from AND e.occurredAt < :to "
        + "AND e.eventType IN :types ORDER BY e.occurredAt ASC")
    List<AuditEvent> findInWindowByTypes(@Param("from") Instant from, @Param("to") Instant to,
                                         @Param("types") Collection<String> types);

    List<AuditEvent> findAllByOrderByOccurredAtDesc(Pageable pageable);

    @Query("SELECT COUNT(e) FROM AuditEvent e WHERE e.occurredAt >= :from AND e.occurredAt < :to")
    long countInWindow(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT COUNT(e) FROM AuditEvent e WHERE e.occurredAt >= :from AND e.occurredAt < :to "
        + "AND e.outcome = :outcome")
    long countInWindowByOutcome(@Param("from") Instant from, @Param("to") Instant to,
                                @Param("outcome") AuditOutcome outcome);

    @Modifying
    @Query("DELETE FROM AuditEvent e WHERE e.classification = :classification AND e.occurredAt < :cutoff")
    int deleteOlderThan(@Param("classification") DataClassification classification,
                        @Param("cutoff") Instant cutoff);
}
