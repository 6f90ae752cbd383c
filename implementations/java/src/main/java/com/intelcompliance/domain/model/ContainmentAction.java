package com.intelcompliance.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One executed containment step. Appended to its incident, never changed.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ContainmentAction {

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 32)
    private ContainmentActionType type;

    @Column(name = "target", length = 256)
    private String target;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16)
    private ContainmentOutcome outcome;

    @Column(name = "detail", length = 1000)
    private String detail;

    @Column(name = "requested_by", nullable = false, length = 128)
    private String requestedBy;

    @Column(name = "executed_at", nullable = false)
    private Instant executedAt;

    public boolean succeeded() {
        return outcome == ContainmentOutcome.SUCCEEDED;
    }
}
