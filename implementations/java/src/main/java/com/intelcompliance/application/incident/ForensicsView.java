package com.intelcompliance.application.incident;

import com.intelcompliance.domain.model.ForensicsCollectionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Decrypted forensics record. The JSON fields are byte-identical to what was
 * collected and signed.
 */
@Value
@Builder
public class ForensicsView {
    UUID recordId;
    String incidentId;
    ForensicsCollectionType collectionType;
    String source;
    int snapshotCount;
    int logEntryCount;
    String snapshotsJson;
    String logExtractJson;
    boolean signatureValid;
    String collectedBy;
    Instant collectedAt;
}
