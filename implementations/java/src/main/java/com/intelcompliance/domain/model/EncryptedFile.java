package com.intelcompliance.domain.model;

import lombok.Value;

/**
 * Result of file encryption: content and metadata are sealed separately so the
 * metadata can be decrypted without touching the (larger, CJI-tier) content.
 */
@Value
public class EncryptedFile {
    EncryptionEnvelope content;
    EncryptionEnvelope metadata;
    /** SHA-256 hex of the plaintext content. */
    String checksum;
}
