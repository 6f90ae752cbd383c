package com.intelcompliance.application.incident;

import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.domain.model.DetectionAlert;
import com.intelcompliance.domain.model.DetectionMethod;
import com.intelcompliance.domain.model.SecurityIncident;
import com.intelcompliance.domain.repository.DetectionAlertRepository;
import com.intelcompliance.infrastructure.detection.DetectionMatch;
import com.intelcompliance.infrastructure.detection.DetectionRule;
import com.intelcompliance.infrastructure.detection.PatternDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Periodic pattern sweep over the audit trail.
 *
 * <p>Runs every configured rule, opens one AUTOMATED incident per new match
 * and records the match as a {@link DetectionAlert} so a later sweep over an
 * overlapping window does not raise it again, even after the window has slid
 * past the burst's first event. Sweeps never overlap: a sweep
 * requested while one is running returns immediately with nothing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IncidentPatternSweep {

    static final String SYSTEM_ACTOR = "system";

    private final PatternDetector detector;
    private final DetectionAlertRepository alertRepository;
    private final IncidentResponseService incidentService;
    private final ComplianceProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean();

    @Scheduled(fixedDelayString = "${compliance.detection.sweep-interval:PT1M}",
        initialDelayString = "${compliance.detection.sweep-interval:PT1M}")
    public void scheduledSweep() {
        if (properties.getDetection().isEnabled()) {
            checkForIncidentPatterns();
        }
    }

    /**
     * @return incidents opened by this sweep; empty when another sweep is in progress
     */
    public List<SecurityIncident> checkForIncidentPatterns() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Pattern sweep already running, skipping");
            return List.of();
        }
        try {
            return sweep(clock.instant());
        } finally {
            running.set(false);
        }
    }

    private List<SecurityIncident> sweep(Instant now) {
        List<SecurityIncident> created = new ArrayList<>();
        for (DetectionRule rule : properties.getDetection().getRules()) {
            List<DetectionMatch> matches;
            try {
                matches = detector.evaluate(rule, now);
            } catch (IllegalArgumentException e) {
                log.error("Detection rule {} skipped: {}", rule.getId(), e.getMessage());
                continue;
            }
            for (DetectionMatch match : matches) {
                if (alreadyRaised(match)) {
                    continue;
                }
                SecurityIncident incident = incidentService.createIncident(toCommand(match));
                alertRepository.save(DetectionAlert.builder()
                    .id(UUID.randomUUID())
                    .dedupeKey(match.dedupeKey())
                    .ruleId(rule.getId())
                    .groupValue(match.groupValue())
                    .aggregateValue(match.aggregateValue())
                    .incidentType(rule.getIncidentType())
                    .severity(rule.getSeverity())
                    .incidentId(incident.getId())
                    .firstEventAt(match.firstEventAt())
                    .lastEventAt(match.lastEventAt())
                    .detectedAt(now)
                    .build());
                created.add(incident);
            }
        }
        if (!created.isEmpty()) {
            log.warn("SECURITY ALERT: pattern sweep opened {} incident(s): {}", created.size(),
                created.stream().map(SecurityIncident::getId).collect(Collectors.joining(", ")));
        }
        return created;
    }

    /**
     * A match is already raised when its key was seen, or when an earlier alert
     * for the same rule and group still shares events with it.
     */
    private boolean alreadyRaised(DetectionMatch match) {
        return alertRepository.existsByDedupeKey(match.dedupeKey())
            || alertRepository.existsOverlapping(match.rule().getId(), match.groupValue(), match.firstEventAt());
    }

    private static CreateIncidentCommand toCommand(DetectionMatch match) {
        DetectionRule rule = match.rule();

        Map<String, Object> findings = new LinkedHashMap<>();
        findings.put("ruleId", rule.getId());
        findings.put("ruleType", rule.getType().name());
        findings.put("groupBy", rule.getGroupBy().name());
        findings.put("groupValue", match.groupValue());
        findings.put("aggregateValue", match.aggregateValue());
        findings.put("threshold", rule.getThreshold());
        findings.put("window", rule.getWindow().toString());
        findings.put("eventCount", match.eventCount());
        findings.put("firstEventAt", match.firstEventAt().toString());
        findings.put("lastEventAt", match.lastEventAt().toString());
        findings.put("eventIds", match.eventIds().stream().map(UUID::toString).collect(Collectors.toList()));

        CreateIncidentCommand.CreateIncidentCommandBuilder command = CreateIncidentCommand.builder()
            .type(rule.getIncidentType())
            .severity(rule.getSeverity())
            .description(rule.describe(match.groupValue(), match.aggregateValue()))
            .detectionMethod(DetectionMethod.AUTOMATED)
            .initialFindings(findings)
            .createdBy(SYSTEM_ACTOR);
        if (rule.getGroupBy() == DetectionRule.GroupBy.ORIGIN_ADDRESS) {
            command.sourceAddress(match.groupValue());
        } else {
            command.affectedUser(match.groupValue());
        }
        return command.build();
    }
}
