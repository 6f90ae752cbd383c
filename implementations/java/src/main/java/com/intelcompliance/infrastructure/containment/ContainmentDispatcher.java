package com.intelcompliance.infrastructure.containment;

import com.intelcompliance.domain.exception.AuditPersistenceException;
import com.intelcompliance.domain.exception.ComplianceException;
import com.intelcompliance.domain.model.ContainmentAction;
import com.intelcompliance.domain.model.ContainmentActionType;
import com.intelcompliance.domain.model.ContainmentOutcome;
import com.intelcompliance.domain.model.SecurityIncident;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Routes each containment action to its executor and turns the result into a
 * {@link ContainmentAction}. One action failing never prevents the next.
 */
@Component
@Slf4j
public class ContainmentDispatcher {

    private static final int MAX_DETAIL = 1000;

    private final List<ContainmentExecutor> executors;
    private final Clock clock;

    public ContainmentDispatcher(List<ContainmentExecutor> executors, Clock clock) {
        this.executors = List.copyOf(executors);
        this.clock = clock;
    }

    public ContainmentAction dispatch(ContainmentActionType type, String target,
                                      SecurityIncident incident, String actor) {
        ContainmentOutcome outcome;
        String detail;
        try {
            detail = executorFor(type).execute(type, target, incident, actor);
            outcome = ContainmentOutcome.SUCCEEDED;
        } catch (AuditPersistenceException e) {
            throw e;
        } catch (ComplianceException e) {
            log.warn("INCIDENT {} containment {} on {} failed: {}", incident.getId(), type, target, e.getMessage());
            outcome = ContainmentOutcome.FAILED;
            detail = e.getMessage();
        } catch (RuntimeException e) {
            log.error("INCIDENT {} containment {} on {} failed unexpectedly", incident.getId(), type, target, e);
            outcome = ContainmentOutcome.FAILED;
            detail = "Unexpected failure: " + e.getClass().getSimpleName();
        }
        return new ContainmentAction(type, target, outcome, truncate(detail), actor, clock.instant());
    }

    private ContainmentExecutor executorFor(ContainmentActionType type) {
        return executors.stream()
            .filter(executor -> executor.supports(type))
            .findFirst()
            .orElseThrow(() -> new ContainmentException("No executor for containment action " + type));
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL);
    }
}
