package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.DecryptedFile;
import com.intelcompliance.domain.model.EncryptedFile;
import com.intelcompliance.domain.model.EncryptionEnvelope;
import com.intelcompliance.domain.model.IntegritySignature;

import java.nio.charset.StandardCharsets;

/**
 * Classification-aware cryptographic operations.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>Use authenticated encryption bound to the caller's context label</li>
 *   <li>Fail closed on any authentication failure, with no partial output</li>
 *   <li>Never log plaintext or key material</li>
 *   <li>Be safe to call concurrently without coordination</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface CryptoService {

    /**
     * Encrypts {@code plaintext} under the active key for the classification.
     *
     * @param plaintext value to protect
     * @param classification sensitivity tier; selects the key purpose
     * @param context label identifying the field or use-site, bound as AAD
     * @return envelope carrying ciphertext and everything needed to decrypt it
     */
    EncryptionEnvelope encrypt(byte[] plaintext, DataClassification classification, String context);

    default EncryptionEnvelope encrypt(String plaintext, DataClassification classification, String context) {
        return encrypt(plaintext == null ? null : plaintext.getBytes(StandardCharsets.UTF_8),
            classification, context);
    }

    /**
     * @throws com.intelcompliance.domain.exception.AuthenticationFailureException
     *         on context mismatch or tag failure
     * @throws com.intelcompliance.domain.exception.KeyNotFoundException
     *         if the envelope's key is unknown or revoked
     */
    byte[] decrypt(EncryptionEnvelope envelope, String context);

    default String decryptToString(EncryptionEnvelope envelope, String context) {
        return new String(decrypt(envelope, context), StandardCharsets.UTF_8);
    }

    /**
     * Same checks and exceptions as {@link #decrypt}, but an authentication
     * failure is not published. For read-only reporting paths.
     */
    byte[] decryptUnreported(EncryptionEnvelope envelope, String context);

    /**
     * Deterministic, salted digest for equality search over encrypted columns.
     */
    String hashForSearch(String value);

    IntegritySignature generateIntegritySignature(byte[] payload);

    /**
     * @return false for any mismatch, unknown signing key or malformed signature
     */
    boolean verifyIntegrity(byte[] payload, IntegritySignature signature);

    /**
     * Same result as {@link #verifyIntegrity}, without publishing a failure.
     */
    boolean checkIntegrity(byte[] payload, IntegritySignature signature);

    EncryptedFile encryptFile(byte[] content, String filename, String mimeType);

    /**
     * @throws com.intelcompliance.domain.exception.FileCorruptionException
     *         if the decrypted content does not match the stored checksum
     */
    DecryptedFile decryptFile(EncryptedFile file);

    /**
     * Round-trips sample data through every operation. Used by health checks.
     */
    CryptoSelfTestReport selfTest();
}
