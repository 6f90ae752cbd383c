package com.intelcompliance.infrastructure.audit;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.AuditOutcome;
import com.intelcompliance.domain.model.DataClassification;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Conjunctive filter over audit events. Unset criteria match everything.
 */
@Value
@Builder
public class AuditEventFilter {

    public static final AuditEventFilter ALL = AuditEventFilter.builder().build();

    @Builder.Default
    Set<String> eventTypes = Set.of();
    @Builder.Default
    Set<String> actions = Set.of();
    AuditOutcome outcome;
    String actorId;
    String originAddress;
    DataClassification classification;

    public static AuditEventFilter ofTypes(String... eventTypes) {
        return AuditEventFilter.builder().eventTypes(Set.of(eventTypes)).build();
    }

    public boolean matches(AuditEvent event) {
        return (eventTypes.isEmpty() || eventTypes.contains(event.getEventType()))
            && (actions.isEmpty() || actions.contains(event.getAction()))
            && (outcome == null || outcome == event.getOutcome())
            && (actorId == null || actorId.equals(event.getActorId()))
            && (originAddress == null || originAddress.equals(event.getOriginAddress()))
            && (classification == null || classification == event.getClassification());
    }
}
