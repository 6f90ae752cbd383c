package com.intelcompliance.infrastructure.audit;

import com.intelcompliance.domain.model.AuditEvent;
import com.intelcompliance.domain.model.TimeWindow;

import java.util.List;
import java.util.Map;

/**
 * Records and reads the security audit trail.
 *
 * <p>Recording is synchronous and never best-effort: if an event cannot be
 * persisted the caller receives an
 * {@link com.intelcompliance.domain.exception.AuditPersistenceException}.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface AuditService {

    /**
     * Validates, signs and appends an event.
     *
     * @return the stored event
     * @throws com.intelcompliance.domain.exception.ValidationException if required fields are missing
     * @throws com.intelcompliance.domain.exception.AuditPersistenceException if the append fails
     */
    AuditEvent record(AuditEventCommand command);

    /**
     * Events inside the window matching the filter, oldest first. Read-only.
     */
    List<AuditEvent> queryWindow(AuditEventFilter filter, TimeWindow window);

    /**
     * Metadata of a stored event, decrypted when sealed.
     */
    Map<String, Object> metadataOf(AuditEvent event);

    /**
     * Recomputes the signature of every event in the window.
     */
    AuditVerificationResult verifyIntegrity(TimeWindow window);

    /**
     * Same verification as {@link #verifyIntegrity} without raising security
     * alerts, so the trail inside the window is left untouched.
     */
    AuditVerificationResult inspectIntegrity(TimeWindow window);
}
