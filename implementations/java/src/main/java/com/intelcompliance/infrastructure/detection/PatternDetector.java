package com.intelcompliance.infrastructure.detection;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.TimeWindow;
import com.intelcompliance.infrastructure.audit.AuditEventFilter;
import com.intelcompliance.infrastructure.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Evaluates detection rules against the audit trail.
 *
 * <p>Stateless: each evaluation reads the rule's window ending at {@code now}
 * and groups the matching events. Deduplication against earlier alerts is the
 * caller's job.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PatternDetector {

    static final int MAX_EVENT_IDS = 50;

    private final AuditService auditService;

    public List<DetectionMatch> evaluate(DetectionRule rule, Instant now) {
        validate(rule);
        TimeWindow window = TimeWindow.through(now, rule.getWindow());

        AuditEventFilter filter = AuditEventFilter.builder()
            .eventTypes(Set.copyOf(rule.getEventTypes()))
            .actions(Set.copyOf(rule.getActions()))
            .outcome(rule.getOutcome())
            .build();

        Map<String, List<AuditEvent>> groups = new LinkedHashMap<>();
        for (AuditEvent event : auditService.queryWindow(filter, window)) {
            String group = groupValue(rule, event);
            if (group != null) {
                groups.computeIfAbsent(group, g -> new ArrayList<>()).add(event);
            }
        }

        List<DetectionMatch> matches = new ArrayList<>();
        for (Map.Entry<String, List<AuditEvent>> group : groups.entrySet()) {
            List<AuditEvent> events = group.getValue();
            long aggregate = aggregate(rule, events);
            if (aggregate <= rule.getThreshold()) {
                continue;
            }
            events.sort(Comparator.comparing(AuditEvent::getOccurredAt));
            Instant first = events.get(0).getOccurredAt();
            Instant last = events.get(events.size() - 1).getOccurredAt();
            List<UUID> ids = events.stream().limit(MAX_EVENT_IDS)
                .map(AuditEvent::getId)
                .collect(Collectors.toList());
            matches.add(new DetectionMatch(rule, group.getKey(), aggregate, events.size(),
                first, last, ids, dedupeKey(rule, group.getKey(), first)));
        }

        if (!matches.isEmpty() && log.isInfoEnabled()) {
            log.info("Detection rule {} matched {} group(s)", rule.getId(), matches.size());
        }
        return matches;
    }

    /**
     * Rule id, group value and the index of the rule-window-sized bucket
     * containing the first matched event.
     */
    static String dedupeKey(DetectionRule rule, String groupValue, Instant firstEventAt) {
        long bucket = Math.floorDiv(firstEventAt.toEpochMilli(), rule.getWindow().toMillis());
        return rule.getId() + ":" + groupValue + ":" + bucket;
    }

    private long aggregate(DetectionRule rule, List<AuditEvent> events) {
        if (rule.getType() == DetectionRuleType.EVENT_COUNT) {
            return events.size();
        }
        long sum = 0;
        for (AuditEvent event : events) {
            Object value = auditService.metadataOf(event).get(rule.getSumField());
            if (value instanceof Number) {
                sum += ((Number) value).longValue();
            } else if (value != null) {
                log.debug("Ignoring non-numeric {} on audit event {}", rule.getSumField(), event.getId());
            }
        }
        return sum;
    }

    private static String groupValue(DetectionRule rule, AuditEvent event) {
        return switch (rule.getGroupBy()) {
            case ORIGIN_ADDRESS -> event.getOriginAddress();
            case ACTOR -> event.getActorId();
        };
    }

    private static void validate(DetectionRule rule) {
        if (rule.getId() == null || rule.getId().isBlank()) {
            throw new IllegalArgumentException("Detection rule id must not be blank");
        }
        if (rule.getWindow() == null || rule.getWindow().isZero() || rule.getWindow().isNegative()) {
            throw new IllegalArgumentException("Detection rule " + rule.getId() + " needs a positive window");
        }
        if (rule.getType() == DetectionRuleType.METADATA_SUM
                && (rule.getSumField() == null || rule.getSumField().isBlank())) {
            throw new IllegalArgumentException("Detection rule " + rule.getId() + " sums no field");
        }
        if (rule.getIncidentType() == null || rule.getSeverity() == null) {
            throw new IllegalArgumentException("Detection rule " + rule.getId() + " has no incident template");
        }
    }
}
