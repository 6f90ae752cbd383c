package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.config.CacheConfiguration;
import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.domain.exception.AuthenticationFailureException;
import com.intelcompliance.domain.exception.FileCorruptionException;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.DecryptedFile;
import com.intelcompliance.domain.model.EncryptedFile;
import com.intelcompliance.domain.model.EncryptionEnvelope;
import com.intelcompliance.domain.model.IntegritySignature;
import com.intelcompliance.domain.model.KeyPurpose;
import com.intelcompliance.support.ComplianceTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AesGcmCryptoServiceTest {

    private ComplianceTestContext ctx;
    private AesGcmCryptoService crypto;

    @BeforeEach
    void setUp() {
        ctx = new ComplianceTestContext();
        crypto = ctx.getCrypto();
    }

    @Test
    void decrypt_returns_original_plaintext() {
        byte[] plaintext = "subject record 4471".getBytes(StandardCharsets.UTF_8);

        EncryptionEnvelope envelope = crypto.encrypt(plaintext, DataClassification.CJI, "person.record");

        assertEquals(DataClassification.CJI, envelope.getClassification());
        assertEquals("person.record", envelope.getContext());
        assertEquals(EncryptionEnvelope.AES_256_GCM, envelope.getAlgorithm());
        assertArrayEquals(plaintext, crypto.decrypt(envelope, "person.record"));
    }

    @Test
    void empty_plaintext_round_trips() {
        EncryptionEnvelope envelope = crypto.encrypt(new byte[0], DataClassification.PUBLIC, "empty.value");

        assertEquals(0, crypto.decrypt(envelope, "empty.value").length);
    }

    @Test
    void same_input_encrypts_to_different_ciphertext() {
        byte[] plaintext = "repeat".getBytes(StandardCharsets.UTF_8);

        EncryptionEnvelope first = crypto.encrypt(plaintext, DataClassification.SENSITIVE, "field.a");
        EncryptionEnvelope second = crypto.encrypt(plaintext, DataClassification.SENSITIVE, "field.a");

        assertFalse(Arrays.equals(first.getNonce(), second.getNonce()));
        assertFalse(Arrays.equals(first.getCiphertext(), second.getCiphertext()));
    }

    @Test
    void classification_selects_key_purpose() {
        EncryptionEnvelope envelope = crypto.encrypt("x".getBytes(StandardCharsets.UTF_8),
            DataClassification.SENSITIVE, "field.a");

        assertEquals(KeyPurpose.SENSITIVE_DATA,
            ctx.getKeyManagement().findKeyMetadata(envelope.getKeyId()).orElseThrow().getPurpose());
    }

    @Test
    void decrypt_under_another_context_fails_and_is_audited() {
        EncryptionEnvelope envelope = crypto.encrypt("ssn".getBytes(StandardCharsets.UTF_8),
            DataClassification.CJI, "person.ssn");

        assertThrows(AuthenticationFailureException.class, () -> crypto.decrypt(envelope, "person.name"));

        List<CryptoAuthenticationFailureEvent> failures =
            ctx.publishedEventsOf(CryptoAuthenticationFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals("decrypt", failures.get(0).operation());
        assertEquals(1, ctx.getAuditRepository().ofType(AuditEventTypes.CRYPTO_AUTHENTICATION_FAILURE).size());
    }

    @Test
    void tampered_ciphertext_fails_authentication() {
        EncryptionEnvelope envelope = crypto.encrypt("balance=100".getBytes(StandardCharsets.UTF_8),
            DataClassification.SENSITIVE, "account.balance");
        byte[] ciphertext = envelope.getCiphertext();
        ciphertext[0] ^= 0x01;
        EncryptionEnvelope tampered = new EncryptionEnvelope(ciphertext, envelope.getNonce(),
            envelope.getAuthTag(), envelope.getKeyId(), envelope.getClassification(),
            envelope.getAlgorithm(), envelope.getContext());

        assertThrows(AuthenticationFailureException.class, () -> crypto.decrypt(tampered, "account.balance"));
    }

    @Test
    void relabelled_classification_fails_authentication() {
        EncryptionEnvelope envelope = crypto.encrypt("x".getBytes(StandardCharsets.UTF_8),
            DataClassification.CJI, "field.a");
        EncryptionEnvelope relabelled = new EncryptionEnvelope(envelope.getCiphertext(), envelope.getNonce(),
            envelope.getAuthTag(), envelope.getKeyId(), DataClassification.PUBLIC,
            envelope.getAlgorithm(), envelope.getContext());

        assertThrows(AuthenticationFailureException.class, () -> crypto.decrypt(relabelled, "field.a"));
    }

    @Test
    void invalid_inputs_are_rejected() {
        byte[] value = "v".getBytes(StandardCharsets.UTF_8);

        assertThrows(ValidationException.class, () -> crypto.encrypt((byte[]) null, DataClassification.CJI, "a.b"));
        assertThrows(ValidationException.class, () -> crypto.encrypt(value, null, "a.b"));
        assertThrows(ValidationException.class, () -> crypto.encrypt(value, DataClassification.CJI, " "));
        assertThrows(ValidationException.class, () -> crypto.encrypt(value, DataClassification.CJI, "no spaces"));
    }

    @Test
    void data_encrypted_before_rotation_still_decrypts() {
        EncryptionEnvelope before = crypto.encrypt("legacy".getBytes(StandardCharsets.UTF_8),
            DataClassification.CJI, "legacy.field");

        ctx.getKeyManagement().rotateKey(KeyPurpose.CJI_DATA, "test rotation");
        EncryptionEnvelope after = crypto.encrypt("fresh".getBytes(StandardCharsets.UTF_8),
            DataClassification.CJI, "legacy.field");

        assertNotEquals(before.getKeyId(), after.getKeyId());
        assertEquals("legacy", new String(crypto.decrypt(before, "legacy.field"), StandardCharsets.UTF_8));
    }

    @Test
    void search_hash_is_normalised_and_deterministic() {
        String hash = crypto.hashForSearch("Analyst@Example.org");

        assertEquals(hash, crypto.hashForSearch("  analyst@example.org "));
        assertNotEquals(hash, crypto.hashForSearch("other@example.org"));
        assertEquals(64, hash.length());
        assertThrows(ValidationException.class, () -> crypto.hashForSearch(" "));
    }

    @Test
    void search_hash_survives_a_restart() {
        String hash = crypto.hashForSearch("Analyst@Example.org");

        AesGcmCryptoService restarted = new AesGcmCryptoService(restartedKeyManagement(ctx.getProperties()),
            ctx.getProperties(), event -> { }, ctx.getClock());

        assertEquals(hash, restarted.hashForSearch("analyst@example.org"));
    }

    @Test
    void search_hash_without_configured_salt_is_derived_from_the_root_secret() {
        ComplianceProperties unsalted = new ComplianceProperties();
        unsalted.getCrypto().setRootSecret(ComplianceTestContext.ROOT_SECRET);
        AesGcmCryptoService first = new AesGcmCryptoService(restartedKeyManagement(unsalted),
            unsalted, event -> { }, ctx.getClock());
        AesGcmCryptoService second = new AesGcmCryptoService(restartedKeyManagement(unsalted),
            unsalted, event -> { }, ctx.getClock());

        assertEquals(first.hashForSearch("case-2231"), second.hashForSearch("case-2231"));
        assertNotEquals(crypto.hashForSearch("case-2231"), first.hashForSearch("case-2231"));
    }

    @Test
    void signature_detects_modified_payload() {
        byte[] payload = "{\"amount\":10}".getBytes(StandardCharsets.UTF_8);
        IntegritySignature signature = crypto.generateIntegritySignature(payload);

        assertTrue(crypto.verifyIntegrity(payload, signature));
        assertFalse(crypto.verifyIntegrity("{\"amount\":11}".getBytes(StandardCharsets.UTF_8), signature));
        assertFalse(crypto.verifyIntegrity(payload,
            new IntegritySignature(signature.getKeyId(), signature.getAlgorithm(), "not-hex")));
    }

    @Test
    void signature_made_before_rotation_still_verifies() {
        byte[] payload = "evidence".getBytes(StandardCharsets.UTF_8);
        IntegritySignature signature = crypto.generateIntegritySignature(payload);

        ctx.getKeyManagement().rotateKey(KeyPurpose.INTEGRITY_SIGNING, "test rotation");

        assertTrue(crypto.verifyIntegrity(payload, signature));
        assertNotEquals(signature.getKeyId(), crypto.generateIntegritySignature(payload).getKeyId());
    }

    @Test
    void file_round_trip_keeps_metadata() {
        byte[] content = "%PDF-1.7 case file".getBytes(StandardCharsets.UTF_8);

        EncryptedFile encrypted = crypto.encryptFile(content, "case-17.pdf", "application/pdf");
        DecryptedFile decrypted = crypto.decryptFile(encrypted);

        assertArrayEquals(content, decrypted.getContent());
        assertEquals("case-17.pdf", decrypted.getFilename());
        assertEquals("application/pdf", decrypted.getMimeType());
        assertEquals(content.length, decrypted.getSize());
        assertEquals(ComplianceTestContext.START, decrypted.getUploadedAt());
        assertEquals(DataClassification.CJI, encrypted.getContent().getClassification());
    }

    @Test
    void file_with_wrong_checksum_is_reported_corrupt() {
        EncryptedFile encrypted = crypto.encryptFile("payload".getBytes(StandardCharsets.UTF_8),
            "a.txt", "text/plain");
        EncryptedFile corrupted = new EncryptedFile(encrypted.getContent(), encrypted.getMetadata(),
            "0".repeat(64));

        assertThrows(FileCorruptionException.class, () -> crypto.decryptFile(corrupted));
    }

    @Test
    void self_test_reports_healthy() {
        CryptoSelfTestReport report = crypto.selfTest();

        assertTrue(report.isHealthy(), () -> "self-test error: " + report.getError());
        assertEquals(4, report.getActiveKeyIds().size());
        assertNull(report.getError());
    }

    private PersistentKeyManagementService restartedKeyManagement(ComplianceProperties properties) {
        PersistentKeyManagementService service = new PersistentKeyManagementService(ctx.getKeyRepository(),
            properties, new CacheConfiguration().cacheManager(), event -> { }, ctx.getClock());
        service.initialize();
        return service;
    }
}
