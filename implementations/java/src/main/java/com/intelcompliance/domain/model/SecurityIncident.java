package com.intelcompliance.domain.model;

import com.intelcompliance.domain.exception.InvalidTransitionException;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Security incident aggregate root.
 *
 * <p>Created automatically by pattern detection or manually by an operator.
 * State only changes through {@link #transitionTo}, which enforces the
 * {@link IncidentState} transition table. Incidents are never deleted; closed
 * incidents stay as compliance history.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Every state change appends exactly one timeline entry</li>
 *   <li>Timeline, containment actions and forensic links are append-only</li>
 *   <li>Concurrent writers are detected via the JPA version column</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Entity
@Table(name = "security_incidents", indexes = {
    @Index(name = "idx_incidents_state", columnList = "state"),
    @Index(name = "idx_incidents_created_at", columnList = "created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class SecurityIncident {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 32)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "incident_type", nullable = false, updatable = false, length = 32)
    private IncidentType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private IncidentSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private IncidentState state;

    @Column(name = "description", nullable = false, length = 5000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "detection_method", nullable = false, updatable = false, length = 16)
    private DetectionMethod detectionMethod;

    @Column(name = "source_address", length = 64)
    private String sourceAddress;

    /** Structured JSON summary of the evidence that triggered the incident. */
    @Column(name = "initial_findings", columnDefinition = "TEXT")
    private String initialFindings;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_affected_systems", joinColumns = @JoinColumn(name = "incident_id"))
    @Column(name = "system_id", length = 128)
    private Set<String> affectedSystems = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_affected_users", joinColumns = @JoinColumn(name = "incident_id"))
    @Column(name = "user_id", length = 128)
    private Set<String> affectedUsers = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_responders", joinColumns = @JoinColumn(name = "incident_id"))
    @Column(name = "responder_id", length = 128)
    private Set<String> responders = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_required_roles", joinColumns = @JoinColumn(name = "incident_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "responder_role", length = 32)
    private Set<ResponderRole> requiredRoles = EnumSet.noneOf(ResponderRole.class);

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_timeline", joinColumns = @JoinColumn(name = "incident_id"))
    @OrderColumn(name = "entry_index")
    private List<IncidentTimelineEntry> timeline = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_containment_actions", joinColumns = @JoinColumn(name = "incident_id"))
    @OrderColumn(name = "action_index")
    private List<ContainmentAction> containmentActions = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_forensic_records", joinColumns = @JoinColumn(name = "incident_id"))
    @OrderColumn(name = "record_index")
    @Column(name = "forensics_record_id", length = 36)
    private List<String> forensicRecordIds = new ArrayList<>();

    @Column(name = "created_by", nullable = false, updatable = false, length = 128)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "response_deadline", nullable = false, updatable = false)
    private Instant responseDeadline;

    @Column(name = "escalated_at")
    private Instant escalatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private SecurityIncident(String id, IncidentType type, IncidentSeverity severity,
                             String description, DetectionMethod detectionMethod,
                             String createdBy, Instant createdAt, Instant responseDeadline) {
        this.id = id;
        this.type = type;
        this.severity = severity;
        this.description = description;
        this.detectionMethod = detectionMethod;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.responseDeadline = responseDeadline;
        this.state = IncidentState.NEW;
    }

    /**
     * Factory for a new incident in state NEW, with its creation timeline entry.
     * Field validation happens in the application service before this is called.
     */
    public static SecurityIncident open(String id, IncidentType type, IncidentSeverity severity,
                                        String description, DetectionMethod detectionMethod,
                                        String sourceAddress, Set<String> affectedSystems,
                                        Set<String> affectedUsers, Set<ResponderRole> requiredRoles,
                                        String initialFindings, String createdBy,
                                        Instant createdAt, Instant responseDeadline) {
        Objects.requireNonNull(id, "Incident id must not be null");
        SecurityIncident incident = new SecurityIncident(id, type, severity, description,
            detectionMethod, createdBy, createdAt, responseDeadline);
        incident.sourceAddress = sourceAddress;
        incident.initialFindings = initialFindings;
        if (affectedSystems != null) {
            incident.affectedSystems.addAll(affectedSystems);
        }
        if (affectedUsers != null) {
            incident.affectedUsers.addAll(affectedUsers);
        }
        if (requiredRoles != null) {
            incident.requiredRoles.addAll(requiredRoles);
        }
        incident.timeline.add(new IncidentTimelineEntry(TimelineEntryType.CREATED, null,
            IncidentState.NEW, "Incident created via " + detectionMethod.getValue() + " detection",
            createdBy, createdAt));
        return incident;
    }

    /**
     * Moves the incident to {@code target}.
     *
     * @throws InvalidTransitionException if the transition table forbids the move
     */
    public IncidentTimelineEntry transitionTo(IncidentState target, String note, String actor, Instant at) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidTransitionException(state, target);
        }
        IncidentTimelineEntry entry = new IncidentTimelineEntry(TimelineEntryType.STATE_CHANGE,
            state, target, note, actor, at);
        this.state = target;
        this.timeline.add(entry);
        this.updatedAt = at;
        return entry;
    }

    public void recordContainment(List<ContainmentAction> actions, String actor, Instant at) {
        if (actions.isEmpty()) {
            return;
        }
        containmentActions.addAll(actions);
        long failed = actions.stream().filter(a -> !a.succeeded()).count();
        timeline.add(new IncidentTimelineEntry(TimelineEntryType.CONTAINMENT, state, state,
            "Containment executed: " + (actions.size() - failed) + " succeeded, " + failed + " failed",
            actor, at));
        this.updatedAt = at;
    }

    public void linkForensics(String recordId, String actor, Instant at) {
        forensicRecordIds.add(recordId);
        timeline.add(new IncidentTimelineEntry(TimelineEntryType.FORENSICS, state, state,
            "Forensics record collected: " + recordId, actor, at));
        this.updatedAt = at;
    }

    public boolean assignResponder(String responderId, String actor, Instant at) {
        if (!responders.add(responderId)) {
            return false;
        }
        timeline.add(new IncidentTimelineEntry(TimelineEntryType.RESPONDER_ASSIGNED, state, state,
            "Responder assigned: " + responderId, actor, at));
        this.updatedAt = at;
        return true;
    }

    public void escalate(String note, Instant at) {
        if (escalatedAt != null) {
            return;
        }
        this.escalatedAt = at;
        timeline.add(new IncidentTimelineEntry(TimelineEntryType.ESCALATION, state, state,
            note, "system", at));
        this.updatedAt = at;
    }

    public boolean isActive() {
        return state.isActive();
    }

    public boolean isEscalated() {
        return escalatedAt != null;
    }

    public boolean isOverdue(Instant now) {
        return state == IncidentState.NEW && now.isAfter(responseDeadline);
    }

    /**
     * First time the incident entered {@code target}, if it ever did.
     */
    public Optional<Instant> enteredStateAt(IncidentState target) {
        return timeline.stream()
            .filter(e -> e.getToState() == target && e.getFromState() != target)
            .map(IncidentTimelineEntry::getOccurredAt)
            .findFirst();
    }

    public Set<String> getAffectedSystems() {
        return Collections.unmodifiableSet(affectedSystems);
    }

    public Set<String> getAffectedUsers() {
        return Collections.unmodifiableSet(affectedUsers);
    }

    public Set<String> getResponders() {
        return Collections.unmodifiableSet(responders);
    }

    public Set<ResponderRole> getRequiredRoles() {
        return Collections.unmodifiableSet(requiredRoles);
    }

    public List<IncidentTimelineEntry> getTimeline() {
        return Collections.unmodifiableList(timeline);
    }

    public List<ContainmentAction> getContainmentActions() {
        return Collections.unmodifiableList(containmentActions);
    }

    public List<String> getForensicRecordIds() {
        return Collections.unmodifiableList(forensicRecordIds);
    }

    @Override
    public String toString() {
        return "SecurityIncident[id=" + id + ", type=" + type + ", severity=" + severity
            + ", state=" + state + "]";
    }
}
