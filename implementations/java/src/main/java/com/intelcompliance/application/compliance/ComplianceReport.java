package com.intelcompliance.application.compliance;

import com.intelcompliance.domain.model.ComplianceStatus;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.PolicyArea;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Structured compliance report for a fixed period. Rendering is left to the consumer.
 */
@Value
@Builder
public class ComplianceReport {
    Instant periodStart;
    Instant periodEnd;
    double overallScore;
    ComplianceStatus overallStatus;
    List<AreaResult> areas;
    Metrics metrics;
    List<ViolationSummary> violations;
    List<String> recommendations;
    String executiveSummary;
    Instant generatedAt;

    /**
     * @param score null when the area is {@link ComplianceStatus#NOT_APPLICABLE}
     */
    public record AreaResult(PolicyArea area, String displayName, Double score, ComplianceStatus status,
                             double weight) {
    }

    public record Metrics(long totalEvents, long deniedEvents, long cjiAccessEvents, long uniqueActors,
                          long uniqueOrigins, long incidentsOpened, long incidentsResolved) {
    }

    public record ViolationSummary(String eventType, long count, IncidentSeverity severity) {
    }
}
