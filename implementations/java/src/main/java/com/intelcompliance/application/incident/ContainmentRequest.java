package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.ContainmentActionType;

/**
 * One requested containment action. The target's meaning depends on the
 * type: a system id, a user id or a network address.
 */
public record ContainmentRequest(ContainmentActionType type, String target) {
}
