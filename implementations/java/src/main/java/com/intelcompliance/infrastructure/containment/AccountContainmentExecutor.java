package com.intelcompliance.infrastructure.containment;

import com.intelcompliance.domain.model.ContainmentActionType;
import com.intelcompliance.domain.model.SecurityIncident;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Session, account and credential actions, delegated to the {@link AccessControlGateway}.
 */
@Component
@RequiredArgsConstructor
public class AccountContainmentExecutor implements ContainmentExecutor {

    private static final Set<ContainmentActionType> SUPPORTED = EnumSet.of(
        ContainmentActionType.TERMINATE_SESSIONS,
        ContainmentActionType.DISABLE_ACCOUNT,
        ContainmentActionType.RESET_CREDENTIALS);

    private final AccessControlGateway gateway;

    @Override
    public boolean supports(ContainmentActionType type) {
        return SUPPORTED.contains(type);
    }

    @Override
    public String execute(ContainmentActionType type, String target, SecurityIncident incident, String actor) {
        if (target == null || target.isBlank()) {
            throw new ContainmentException(type + " requires a user id");
        }
        switch (type) {
            case TERMINATE_SESSIONS -> gateway.terminateSessions(target, incident.getId(), actor);
            case DISABLE_ACCOUNT -> gateway.disableAccount(target, incident.getId(), actor);
            case RESET_CREDENTIALS -> gateway.resetCredentials(target, incident.getId(), actor);
            default -> throw new ContainmentException("Unsupported account action " + type);
        }
        return type + " requested for " + target;
    }
}
