package com.intelcompliance.application.compliance;

import com.intelcompliance.domain.model.IncidentSeverity;
import com.intelcompliance.domain.model.PolicyArea;

/**
 * @param score the area's current score; null for gaps not derived from a score
 */
public record ComplianceGap(PolicyArea area, String description, IncidentSeverity severity,
                            String recommendation, Double score) {
}
