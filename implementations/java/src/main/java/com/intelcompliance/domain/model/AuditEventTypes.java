package com.intelcompliance.domain.model;

/**
 * Well-known audit event types. Collaborators may report others; these are the
 * ones the core itself emits or has detection rules for.
 */
public final class AuditEventTypes {

    public static final String LOGIN_SUCCESS = "LOGIN_SUCCESS";
    public static final String LOGIN_FAILED = "LOGIN_FAILED";
    public static final String LOGOUT = "LOGOUT";
    public static final String DATA_ACCESS = "DATA_ACCESS";
    public static final String DATA_EXPORT = "DATA_EXPORT";
    public static final String FILE_UPLOAD = "FILE_UPLOAD";
    public static final String FILE_DOWNLOAD = "FILE_DOWNLOAD";
    public static final String ACCESS_DENIED = "ACCESS_DENIED";
    public static final String CONFIG_CHANGE = "CONFIG_CHANGE";

    public static final String KEY_CREATED = "KEY_CREATED";
    public static final String KEY_ROTATED = "KEY_ROTATED";
    public static final String KEY_REVOKED = "KEY_REVOKED";
    public static final String CRYPTO_AUTHENTICATION_FAILURE = "CRYPTO_AUTHENTICATION_FAILURE";

    public static final String INCIDENT_CREATED = "INCIDENT_CREATED";
    public static final String INCIDENT_STATE_CHANGED = "INCIDENT_STATE_CHANGED";
    public static final String INCIDENT_RESPONDER_ASSIGNED = "INCIDENT_RESPONDER_ASSIGNED";
    public static final String INCIDENT_ESCALATED = "INCIDENT_ESCALATED";
    public static final String INCIDENT_REPORT_GENERATED = "INCIDENT_REPORT_GENERATED";
    public static final String CONTAINMENT_EXECUTED = "CONTAINMENT_EXECUTED";
    public static final String CONTAINMENT_REQUESTED = "CONTAINMENT_REQUESTED";
    public static final String FORENSICS_COLLECTED = "FORENSICS_COLLECTED";

    public static final String AUDIT_RETENTION_PURGE = "AUDIT_RETENTION_PURGE";

    private AuditEventTypes() {
    }
}
