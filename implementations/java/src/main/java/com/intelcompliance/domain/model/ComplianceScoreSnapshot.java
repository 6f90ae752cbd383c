package com.intelcompliance.domain.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.MapKeyEnumerated;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Point-in-time compliance scores. Snapshots are kept for trend reporting;
 * a newer one supersedes but never overwrites an older one.
 */
@Entity
@Immutable
@Table(name = "compliance_score_snapshots", indexes = {
    @Index(name = "idx_compliance_snapshots_computed_at", columnList = "computed_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ComplianceScoreSnapshot {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "compliance_area_scores", joinColumns = @JoinColumn(name = "snapshot_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "policy_area", length = 48)
    @Column(name = "score", nullable = false)
    private Map<PolicyArea, Double> areaScores = new EnumMap<>(PolicyArea.class);

    @Column(name = "violation_count", nullable = false)
    private long violationCount;

    @Column(name = "overall_score", nullable = false)
    private double overallScore;

    @Column(name = "period_start", nullable = false)
    private Instant periodStart;

    @Column(name = "period_end", nullable = false)
    private Instant periodEnd;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    public ComplianceScoreSnapshot(UUID id, Map<PolicyArea, Double> areaScores, long violationCount,
                                   double overallScore, TimeWindow period, Instant computedAt) {
        this.id = id;
        if (!areaScores.isEmpty()) {
            this.areaScores = new EnumMap<>(areaScores);
        }
        this.violationCount = violationCount;
        this.overallScore = overallScore;
        this.periodStart = period.from();
        this.periodEnd = period.to();
        this.computedAt = computedAt;
    }

    public Map<PolicyArea, Double> getAreaScores() {
        return Collections.unmodifiableMap(areaScores);
    }
}
