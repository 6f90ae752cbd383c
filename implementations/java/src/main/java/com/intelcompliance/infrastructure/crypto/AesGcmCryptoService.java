package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.domain.exception.AuthenticationFailureException;
import com.intelcompliance.domain.exception.CryptoException;
import com.intelcompliance.domain.exception.FileCorruptionException;
import com.intelcompliance.domain.exception.KeyNotFoundException;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.DecryptedFile;
import com.intelcompliance.domain.model.EncryptedFile;
import com.intelcompliance.domain.model.EncryptionEnvelope;
import com.intelcompliance.domain.model.IntegritySignature;
import com.intelcompliance.domain.model.KeyPurpose;
import com.intelcompliance.infrastructure.serialization.CanonicalJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * AES-256-GCM implementation of {@link CryptoService}.
 *
 * <p>Architecture:
 * <ul>
 *   <li>Data keys and signing keys come from the {@link KeyManagementService}</li>
 *   <li>Fresh 96-bit nonce per encryption, 128-bit authentication tag</li>
 *   <li>AAD = canonical JSON of algorithm, classification, context and key id</li>
 *   <li>Integrity signatures are HMAC-SHA256 under the INTEGRITY_SIGNING key</li>
 *   <li>Search hashes are HMAC-SHA256 under a fixed, configured salt</li>
 * </ul>
 *
 * <p>Every authentication failure is logged and published as a
 * {@link CryptoAuthenticationFailureEvent} so the audit trail records it.
 * The unreported variants ({@link #checkIntegrity}, {@link #decryptUnreported})
 * only return the outcome.
 */
@Service
@Slf4j
public class AesGcmCryptoService implements CryptoService {

    private static final String ALGORITHM = EncryptionEnvelope.AES_256_GCM;
    private static final int GCM_IV_LENGTH = 12; // 96 bits recommended for GCM
    private static final int GCM_TAG_LENGTH = 128; // 128 bits authentication tag

    static final String FILE_CONTENT_CONTEXT = "file.content";
    static final String FILE_METADATA_CONTEXT = "file.metadata";

    private final KeyManagementService keyManagementService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final SecretKey searchHashKey;

    private final SecureRandom secureRandom = new SecureRandom();

    public AesGcmCryptoService(KeyManagementService keyManagementService,
                               ComplianceProperties properties,
                               ApplicationEventPublisher eventPublisher,
                               Clock clock) {
        this.keyManagementService = keyManagementService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.searchHashKey = deriveSearchHashKey(properties.getCrypto());
    }

    @Override
    public EncryptionEnvelope encrypt(byte[] plaintext, DataClassification classification, String context) {
        if (plaintext == null) {
            throw new ValidationException("value", "must not be null");
        }
        if (classification == null) {
            throw new ValidationException("classification", "must not be null");
        }
        String label = requireContext(context);

        KeyHandle key = keyManagementService.activeKey(classification.getKeyPurpose());
        byte[] iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key.material(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(associatedData(classification, label, key.keyId()));

            // GCM produces ciphertext || auth_tag
            byte[] ciphertextWithTag = cipher.doFinal(plaintext);
            int ciphertextLength = ciphertextWithTag.length - (GCM_TAG_LENGTH / 8);

            byte[] ciphertext = Arrays.copyOfRange(ciphertextWithTag, 0, ciphertextLength);
            byte[] authTag = Arrays.copyOfRange(ciphertextWithTag, ciphertextLength, ciphertextWithTag.length);

            if (log.isDebugEnabled()) {
                log.debug("Encrypted {} bytes as {} under context {}", plaintext.length, classification, label);
            }
            return new EncryptionEnvelope(ciphertext, iv, authTag, key.keyId(), classification, ALGORITHM, label);

        } catch (GeneralSecurityException e) {
            log.error("Encryption failed", e);
            throw new CryptoException("Failed to encrypt data", e);
        }
    }

    @Override
    public byte[] decrypt(EncryptionEnvelope envelope, String context) {
        return decrypt(envelope, context, true);
    }

    @Override
    public byte[] decryptUnreported(EncryptionEnvelope envelope, String context) {
        return decrypt(envelope, context, false);
    }

    private byte[] decrypt(EncryptionEnvelope envelope, String context, boolean report) {
        if (envelope == null) {
            throw new ValidationException("envelope", "must not be null");
        }
        String label = requireContext(context);

        if (!ALGORITHM.equals(envelope.getAlgorithm())) {
            throw authenticationFailure(report, "decrypt", envelope.getKeyId(), label,
                "unsupported algorithm " + envelope.getAlgorithm());
        }
        if (!label.equals(envelope.getContext())) {
            throw authenticationFailure(report, "decrypt", envelope.getKeyId(), label, "context label mismatch");
        }

        KeyHandle key = keyManagementService.getKey(envelope.getKeyId());
        if (key.purpose() != envelope.getClassification().getKeyPurpose()) {
            throw authenticationFailure(report, "decrypt", envelope.getKeyId(), label,
                "key purpose does not match classification");
        }

        try {
            byte[] ciphertextWithTag = ByteBuffer.allocate(
                    envelope.getCiphertext().length + envelope.getAuthTag().length)
                .put(envelope.getCiphertext())
                .put(envelope.getAuthTag())
                .array();

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key.material(),
                new GCMParameterSpec(GCM_TAG_LENGTH, envelope.getNonce()));
            cipher.updateAAD(associatedData(envelope.getClassification(), label, envelope.getKeyId()));
            return cipher.doFinal(ciphertextWithTag);

        } catch (AEADBadTagException e) {
            throw authenticationFailure(report, "decrypt", envelope.getKeyId(), label, "authentication tag mismatch");
        } catch (GeneralSecurityException e) {
            log.error("Decryption failed for key {}", envelope.getKeyId(), e);
            throw new CryptoException("Failed to decrypt data", e);
        }
    }

    @Override
    public String hashForSearch(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("value", "must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return HexFormat.of().formatHex(hmac(searchHashKey, normalized.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public IntegritySignature generateIntegritySignature(byte[] payload) {
        if (payload == null) {
            throw new ValidationException("payload", "must not be null");
        }
        KeyHandle key = keyManagementService.activeKey(KeyPurpose.INTEGRITY_SIGNING);
        return new IntegritySignature(key.keyId(), IntegritySignature.HMAC_SHA256,
            HexFormat.of().formatHex(hmac(key.material(), payload)));
    }

    @Override
    public boolean verifyIntegrity(byte[] payload, IntegritySignature signature) {
        return verifyIntegrity(payload, signature, true);
    }

    @Override
    public boolean checkIntegrity(byte[] payload, IntegritySignature signature) {
        return verifyIntegrity(payload, signature, false);
    }

    private boolean verifyIntegrity(byte[] payload, IntegritySignature signature, boolean report) {
        if (payload == null || signature == null
                || !IntegritySignature.HMAC_SHA256.equals(signature.getAlgorithm())) {
            return false;
        }

        KeyHandle key;
        try {
            key = keyManagementService.getKey(signature.getKeyId());
        } catch (KeyNotFoundException e) {
            return rejected(report, signature.getKeyId(), "signing key unavailable");
        }
        if (key.purpose() != KeyPurpose.INTEGRITY_SIGNING) {
            return rejected(report, signature.getKeyId(), "key is not a signing key");
        }

        byte[] expected;
        try {
            expected = HexFormat.of().parseHex(signature.getValue());
        } catch (IllegalArgumentException e) {
            return rejected(report, signature.getKeyId(), "malformed signature value");
        }

        boolean valid = MessageDigest.isEqual(expected, hmac(key.material(), payload));
        return valid || rejected(report, signature.getKeyId(), "signature mismatch");
    }

    @Override
    public EncryptedFile encryptFile(byte[] content, String filename, String mimeType) {
        if (content == null) {
            throw new ValidationException("content", "must not be null");
        }
        if (filename == null || filename.isBlank()) {
            throw new ValidationException("filename", "must not be blank");
        }
        if (mimeType == null || mimeType.isBlank()) {
            throw new ValidationException("mimeType", "must not be blank");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("filename", filename);
        metadata.put("mimeType", mimeType);
        metadata.put("size", content.length);
        metadata.put("uploadedAt", clock.instant().toString());

        EncryptionEnvelope sealedContent = encrypt(content, DataClassification.CJI, FILE_CONTENT_CONTEXT);
        EncryptionEnvelope sealedMetadata = encrypt(CanonicalJson.bytes(metadata),
            DataClassification.SENSITIVE, FILE_METADATA_CONTEXT);

        return new EncryptedFile(sealedContent, sealedMetadata, sha256Hex(content));
    }

    @Override
    public DecryptedFile decryptFile(EncryptedFile file) {
        if (file == null) {
            throw new ValidationException("file", "must not be null");
        }
        byte[] content = decrypt(file.getContent(), FILE_CONTENT_CONTEXT);
        Map<String, Object> metadata = CanonicalJson.readMap(
            decryptToString(file.getMetadata(), FILE_METADATA_CONTEXT));

        if (!MessageDigest.isEqual(
                sha256Hex(content).getBytes(StandardCharsets.US_ASCII),
                String.valueOf(file.getChecksum()).getBytes(StandardCharsets.US_ASCII))) {
            log.error("SECURITY ALERT: file integrity check failed for {}", metadata.get("filename"));
            throw new FileCorruptionException("File integrity check failed: checksum mismatch");
        }

        Object size = metadata.get("size");
        Object uploadedAt = metadata.get("uploadedAt");
        return new DecryptedFile(content,
            (String) metadata.get("filename"),
            (String) metadata.get("mimeType"),
            size instanceof Number ? ((Number) size).longValue() : content.length,
            uploadedAt != null ? Instant.parse(uploadedAt.toString()) : null);
    }

    @Override
    public CryptoSelfTestReport selfTest() {
        Instant now = clock.instant();
        CryptoSelfTestReport.CryptoSelfTestReportBuilder report = CryptoSelfTestReport.builder().testedAt(now);
        byte[] sample = ("self-test " + now).getBytes(StandardCharsets.UTF_8);
        try {
            EncryptionEnvelope envelope = encrypt(sample, DataClassification.CJI, "health.self-test");
            report.encryptionWorking(true);
            report.decryptionWorking(Arrays.equals(sample, decrypt(envelope, "health.self-test")));
            report.integrityWorking(verifyIntegrity(sample, generateIntegritySignature(sample)));
            report.searchHashWorking(hashForSearch("self-test").equals(hashForSearch(" SELF-TEST ")));

            Map<KeyPurpose, String> activeKeyIds = new EnumMap<>(KeyPurpose.class);
            for (KeyPurpose purpose : KeyPurpose.values()) {
                if (purpose.isIssuable()) {
                    activeKeyIds.put(purpose, keyManagementService.activeKey(purpose).keyId());
                }
            }
            report.activeKeyIds(activeKeyIds);
        } catch (RuntimeException e) {
            log.error("Cryptographic self-test failed", e);
            report.error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return report.build();
    }

    private static String requireContext(String context) {
        try {
            return EncryptionEnvelope.validateContext(context);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("context", e.getMessage());
        }
    }

    private static byte[] associatedData(DataClassification classification, String context, String keyId) {
        Map<String, Object> aad = new LinkedHashMap<>();
        aad.put("algorithm", ALGORITHM);
        aad.put("classification", classification.name());
        aad.put("context", context);
        aad.put("keyId", keyId);
        return CanonicalJson.bytes(aad);
    }

    private AuthenticationFailureException authenticationFailure(boolean report, String operation, String keyId,
                                                                  String context, String reason) {
        if (report) {
            reportFailure(operation, keyId, context, reason);
        }
        return new AuthenticationFailureException("Authentication failed: " + reason);
    }

    private boolean rejected(boolean report, String keyId, String reason) {
        if (report) {
            reportFailure("verify", keyId, null, reason);
        }
        return false;
    }

    private void reportFailure(String operation, String keyId, String context, String reason) {
        log.warn("AUTHENTICATION FAILURE operation={} keyId={} context={} reason={}",
            operation, keyId, context, reason);
        eventPublisher.publishEvent(
            new CryptoAuthenticationFailureEvent(operation, keyId, context, reason, clock.instant()));
    }

    private static byte[] hmac(SecretKey key, byte[] data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key.getEncoded(), "HmacSHA256"));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("HMAC computation failed", e);
        }
    }

    static String sha256Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoException("SHA-256 unavailable", e);
        }
    }

    private static SecretKey deriveSearchHashKey(ComplianceProperties.Crypto crypto) {
        String salt = crypto.getSearchHashSalt();
        if (salt != null && !salt.isBlank()) {
            return new SecretKeySpec(salt.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        }
        byte[] root = RootKeyWrapper.decodeSecret(crypto.getRootSecret());
        try {
            byte[] derived = hmac(new SecretKeySpec(root, "HmacSHA256"),
                "search-hash-salt".getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(derived, "HmacSHA256");
        } finally {
            Arrays.fill(root, (byte) 0);
        }
    }
}
