package com.intelcompliance.infrastructure.detection;

import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.IncidentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * A pattern-detection rule, expressed as data.
 *
 * <p>Rules are bound from configuration so new patterns only need a new entry,
 * not new code. A rule fires for a group when the group's aggregate inside the
 * sliding window strictly exceeds {@link #threshold}.
 *
 * <pre>
 * compliance.detection.rules:
 *   - id: brute-force-login
 *     type: EVENT_COUNT
 *     event-types: [LOGIN_FAILED]
 *     group-by: ORIGIN_ADDRESS
 *     threshold: 10
 *     window: 5m
 *     incident-type: BRUTE_FORCE
 *     severity: MEDIUM
 * </pre>
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRule {

    private String id;

    @Builder.Default
    private DetectionRuleType type = DetectionRuleType.EVENT_COUNT;

    /** Event types considered; empty means any type. */
    @Builder.Default
    private List<String> eventTypes = new ArrayList<>();

    /** Actions considered; empty means any action. */
    @Builder.Default
    private List<String> actions = new ArrayList<>();

    /** Outcome filter; null means any outcome. */
    private AuditOutcome outcome;

    @Builder.Default
    private GroupBy groupBy = GroupBy.ORIGIN_ADDRESS;

    private long threshold;

    private Duration window;

    /** Numeric metadata field summed by {@link DetectionRuleType#METADATA_SUM} rules. */
    private String sumField;

    private IncidentType incidentType;

    private IncidentSeverity severity;

    /** Incident description; {@code {group}} and {@code {value}} are substituted. */
    private String description;

    public String describe(String groupValue, long aggregate) {
        String template = description != null ? description
            : "Rule " + id + " matched for {group} ({value})";
        return template.replace("{group}", String.valueOf(groupValue))
            .replace("{value}", String.valueOf(aggregate));
    }

    public enum GroupBy {
        ORIGIN_ADDRESS,
        ACTOR
    }
}
