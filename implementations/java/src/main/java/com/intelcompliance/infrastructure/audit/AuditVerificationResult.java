package com.intelcompliance.infrastructure.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AuditVerificationResult {
    boolean verified;
    long totalRecords;
    List<UUID> failedRecordIds;
    Instant verifiedAt;

    public long validRecords() {
        return totalRecords - failedRecordIds.size();
    }
}
