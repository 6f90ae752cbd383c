package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.domain.model.KeyMetadata;
import com.intelcompliance.domain.model.KeyPurpose;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class KeyReport {
    long totalKeys;
    long activeKeys;
    long retiredKeys;
    long revokedKeys;
    /** Active keys whose rotation is due within the warning window (or overdue). */
    List<KeyMetadata> rotationsDue;
    Map<KeyPurpose, Long> keysByPurpose;
    KeyMetadata oldestActiveKey;
    KeyMetadata newestActiveKey;
    Instant generatedAt;
}
