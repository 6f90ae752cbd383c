package com.intelcompliance.infrastructure.forensics;

/**
 * Unsealed content of a forensics record.
 *
 * @param snapshotsJson canonical JSON exactly as collected
 * @param logExtractJson canonical JSON exactly as collected
 * @param signatureValid whether the stored signature still matches the content
 */
public record ForensicsContents(String snapshotsJson, String logExtractJson, boolean signatureValid) {
}
