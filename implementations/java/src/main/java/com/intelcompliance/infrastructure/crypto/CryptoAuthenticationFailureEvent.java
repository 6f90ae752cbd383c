package com.intelcompliance.infrastructure.crypto;

import java.time.Instant;

/**
 * Published whenever authenticated decryption or signature verification fails.
 */
public record CryptoAuthenticationFailureEvent(String operation, String keyId, String context,
                                               String reason, Instant occurredAt) {
}
