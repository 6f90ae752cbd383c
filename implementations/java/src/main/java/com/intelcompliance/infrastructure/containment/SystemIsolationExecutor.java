package com.intelcompliance.infrastructure.containment;

import com.intelcompliance.domain.model.ContainmentActionType;
import com.intelcompliance.domain.model.SecurityIncident;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Marks systems as network-isolated. The isolation register is what the
 * network layer enforces; isolation holds until the system is released.
 */
@Component
@Slf4j
public class SystemIsolationExecutor implements ContainmentExecutor {

    private static final int MAX_SYSTEM_ID = 128;

    private final Map<String, SystemIsolation> isolated = new ConcurrentHashMap<>();
    private final Clock clock;

    public SystemIsolationExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean supports(ContainmentActionType type) {
        return type == ContainmentActionType.ISOLATE_SYSTEM;
    }

    @Override
    public String execute(ContainmentActionType type, String target, SecurityIncident incident, String actor) {
        if (target == null || target.isBlank() || target.length() > MAX_SYSTEM_ID) {
            throw new ContainmentException("A system identifier of 1-" + MAX_SYSTEM_ID + " characters is required");
        }
        SystemIsolation isolation = new SystemIsolation(target, incident.getId(), actor, clock.instant());
        SystemIsolation existing = isolated.putIfAbsent(target, isolation);
        if (existing != null) {
            return "System " + target + " already isolated since " + existing.isolatedAt()
                + " (incident " + existing.incidentId() + ")";
        }
        log.warn("SECURITY ALERT: system {} isolated for incident {}", target, incident.getId());
        return "System " + target + " isolated";
    }

    public boolean isIsolated(String systemId) {
        return systemId != null && isolated.containsKey(systemId);
    }

    public Optional<SystemIsolation> isolationOf(String systemId) {
        return Optional.ofNullable(systemId).map(isolated::get);
    }

    public boolean release(String systemId) {
        boolean released = systemId != null && isolated.remove(systemId) != null;
        if (released) {
            log.info("System {} released from isolation", systemId);
        }
        return released;
    }

    public record SystemIsolation(String systemId, String incidentId, String isolatedBy, Instant isolatedAt) {
    }
}
