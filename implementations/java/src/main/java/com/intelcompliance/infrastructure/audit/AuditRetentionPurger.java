package com.intelcompliance.infrastructure.audit;

import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Removes audit events past their classification's retention period.
 *
 * <p>This is the only path that deletes audit rows. Each run leaves an
 * {@code AUDIT_RETENTION_PURGE} event behind with the per-tier counts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditRetentionPurger {

    private final AuditEventRepository repository;
    private final AuditService auditService;
    private final ComplianceProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${compliance.audit.purge-cron:0 30 3 * * *}")
    public Map<DataClassification, Integer> purge() {
        Instant now = clock.instant();
        Map<DataClassification, Integer> removed = new EnumMap<>(DataClassification.class);
        int total = 0;

        for (DataClassification classification : DataClassification.values()) {
            Instant cutoff = now.minus(properties.getAudit().retentionFor(classification));
            int count = repository.deleteOlderThan(classification, cutoff);
            removed.put(classification, count);
            total += count;
        }

        AuditEventCommand.AuditEventCommandBuilder summary = AuditEventCommand.builder()
            .eventType(AuditEventTypes.AUDIT_RETENTION_PURGE)
            .action("purge")
            .actorId("system")
            .resourceType("audit_events")
            .classification(DataClassification.SENSITIVE)
            .outcome(AuditOutcome.SUCCESS)
            .metadataEntry("total", total);
        removed.forEach((classification, count) -> summary.metadataEntry(classification.name(), count));
        auditService.record(summary.build());

        if (log.isInfoEnabled()) {
            log.info("AUDIT retention purge completed: {} events removed {}", total, removed);
        }
        return removed;
    }
}
