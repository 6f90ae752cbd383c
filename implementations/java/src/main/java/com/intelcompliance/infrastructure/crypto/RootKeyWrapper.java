package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.domain.exception.CryptoException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Wraps and unwraps managed key material under the root secret (AES-256-GCM).
 * The key id and purpose are bound as additional authenticated data so a
 * wrapped blob cannot be moved to another key record.
 */
final class RootKeyWrapper {

    static final int GCM_IV_LENGTH = 12;
    static final int GCM_TAG_LENGTH = 128;

    private final SecretKey rootKey;
    private final SecureRandom secureRandom;

    RootKeyWrapper(byte[] rootSecret, SecureRandom secureRandom) {
        if (rootSecret.length != 32) {
            throw new IllegalStateException("Root secret must be 256 bits, got " + rootSecret.length * 8);
        }
        this.rootKey = new SecretKeySpec(rootSecret, "AES");
        this.secureRandom = secureRandom;
    }

    /**
     * Decodes a configured root secret given as 64 hex characters or base64.
     *
     * @throws IllegalStateException if absent or not 32 bytes
     */
    static byte[] decodeSecret(String configured) {
        if (configured == null || configured.isBlank()) {
            throw new IllegalStateException(
                "No root secret configured (compliance.crypto.root-secret); refusing to start key management");
        }
        String value = configured.trim();
        byte[] decoded;
        try {
            decoded = value.length() == 64 && value.matches("^[0-9a-fA-F]+$")
                ? HexFormat.of().parseHex(value)
                : Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Root secret is neither hex nor base64", e);
        }
        if (decoded.length != 32) {
            Arrays.fill(decoded, (byte) 0);
            throw new IllegalStateException("Root secret must decode to 32 bytes");
        }
        return decoded;
    }

    WrappedKey wrap(byte[] material, String keyId, String purpose) {
        byte[] iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, rootKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(aad(keyId, purpose));
            return new WrappedKey(cipher.doFinal(material), iv);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to wrap key " + keyId, e);
        }
    }

    byte[] unwrap(byte[] wrapped, byte[] iv, String keyId, String purpose) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, rootKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(aad(keyId, purpose));
            return cipher.doFinal(wrapped);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to unwrap key " + keyId + " (root secret mismatch or tampering)", e);
        }
    }

    private static byte[] aad(String keyId, String purpose) {
        return (keyId + "|" + purpose).getBytes(StandardCharsets.UTF_8);
    }

    record WrappedKey(byte[] ciphertext, byte[] iv) {}
}
