package com.intelcompliance.domain.model;

import lombok.Getter;

import java.time.Duration;

/**
 * Sensitivity tier attached to every encrypted field, file and audit event.
 *
 * <p>The tier selects the key purpose used for encryption and the default
 * retention period applied to audit events. A record's classification is
 * fixed once assigned; reclassifying requires re-encryption under the new tier.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Getter
public enum DataClassification {

    PUBLIC(KeyPurpose.PUBLIC_DATA, Duration.ofDays(365)),
    SENSITIVE(KeyPurpose.SENSITIVE_DATA, Duration.ofDays(3 * 365)),
    /** Criminal justice information. */
    CJI(KeyPurpose.CJI_DATA, Duration.ofDays(7 * 365));

    private final KeyPurpose keyPurpose;
    private final Duration defaultRetention;

    DataClassification(KeyPurpose keyPurpose, Duration defaultRetention) {
        this.keyPurpose = keyPurpose;
        this.defaultRetention = defaultRetention;
    }

    public boolean isAtLeast(DataClassification other) {
        return ordinal() >= other.ordinal();
    }
}
