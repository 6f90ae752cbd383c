package com.intelcompliance.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * A detection rule match that produced an incident. The unique dedupe key
 * prevents a repeated sweep over the same window from raising it twice; the
 * recorded event span keeps a sliding window from re-raising the same burst.
 */
@Entity
@Immutable
@Table(name = "detection_alerts", indexes = {
    @Index(name = "uk_detection_alerts_dedupe", columnList = "dedupe_key", unique = true),
    @Index(name = "idx_detection_alerts_detected_at", columnList = "detected_at"),
    @Index(name = "idx_detection_alerts_rule_group", columnList = "rule_id, group_value, last_event_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DetectionAlert {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "dedupe_key", nullable = false, length = 256)
    private String dedupeKey;

    @Column(name = "rule_id", nullable = false, length = 64)
    private String ruleId;

    @Column(name = "group_value", length = 128)
    private String groupValue;

    @Column(name = "aggregate_value", nullable = false)
    private long aggregateValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "incident_type", nullable = false, length = 32)
    private IncidentType incidentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private IncidentSeverity severity;

    @Column(name = "incident_id", length = 32)
    private String incidentId;

    @Column(name = "first_event_at", nullable = false)
    private Instant firstEventAt;

    @Column(name = "last_event_at", nullable = false)
    private Instant lastEventAt;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Builder
    private DetectionAlert(UUID id, String dedupeKey, String ruleId, String groupValue,
                           long aggregateValue, IncidentType incidentType, IncidentSeverity severity,
                           String incidentId, Instant firstEventAt, Instant lastEventAt,
                           Instant detectedAt) {
        this.id = id;
        this.dedupeKey = dedupeKey;
        this.ruleId = ruleId;
        this.groupValue = groupValue;
        this.aggregateValue = aggregateValue;
        this.incidentType = incidentType;
        this.severity = severity;
        this.incidentId = incidentId;
        this.firstEventAt = firstEventAt;
        this.lastEventAt = lastEventAt;
        this.detectedAt = detectedAt;
    }
}
