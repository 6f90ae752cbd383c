package com.intelcompliance.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Incident lifecycle states and the transitions allowed between them.
 *
 * <pre>
 * NEW → TRIAGED → CONTAINED → INVESTIGATING → RECOVERING → RESOLVED → CLOSED
 *                     ↑______________|
 * </pre>
 *
 * Transitions are one-directional except that INVESTIGATING may re-enter
 * CONTAINED when containment has to be repeated.
 */
public enum IncidentState {
    NEW,
    TRIAGED,
    CONTAINED,
    INVESTIGATING,
    RECOVERING,
    RESOLVED,
    CLOSED;

    private static final Map<IncidentState, Set<IncidentState>> TRANSITIONS =
        new EnumMap<>(IncidentState.class);

    static {
        TRANSITIONS.put(NEW, EnumSet.of(TRIAGED));
        TRANSITIONS.put(TRIAGED, EnumSet.of(CONTAINED));
        TRANSITIONS.put(CONTAINED, EnumSet.of(INVESTIGATING));
        TRANSITIONS.put(INVESTIGATING, EnumSet.of(RECOVERING, CONTAINED));
        TRANSITIONS.put(RECOVERING, EnumSet.of(RESOLVED));
        TRANSITIONS.put(RESOLVED, EnumSet.of(CLOSED));
        TRANSITIONS.put(CLOSED, EnumSet.noneOf(IncidentState.class));

        for (IncidentState state : values()) {
            if (!TRANSITIONS.containsKey(state)) {
                throw new ExceptionInInitializerError("No transition entry for " + state);
            }
        }
    }

    public boolean canTransitionTo(IncidentState target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<IncidentState> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    /** Resolved and closed incidents no longer count as active. */
    public boolean isActive() {
        return this != RESOLVED && this != CLOSED;
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
