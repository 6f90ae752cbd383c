package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.config.CacheConfiguration;
import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.domain.exception.KeyNotFoundException;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.AuditEventTypes;
import com.intelcompliance.domain.model.DataClassification;
import com.intelcompliance.domain.model.EncryptionEnvelope;
import com.intelcompliance.domain.model.KeyMetadata;
import com.intelcompliance.domain.model.KeyPurpose;
import com.intelcompliance.domain.model.KeyStatus;
import com.intelcompliance.support.ComplianceTestContext;
import com.intelcompliance.support.InMemoryCryptoKeyRepository;
import com.intelcompliance.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCache;
import org.springframework.cache.support.SimpleCacheManager;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PersistentKeyManagementServiceTest {

    private ComplianceTestContext ctx;
    private PersistentKeyManagementService kms;

    @BeforeEach
    void setUp() {
        ctx = new ComplianceTestContext();
        kms = ctx.getKeyManagement();
    }

    @Test
    void initialization_issues_one_active_key_per_purpose() {
        KeyReport report = kms.keyReport();

        assertEquals(4, report.getTotalKeys());
        assertEquals(4, report.getActiveKeys());
        assertEquals(0, report.getRetiredKeys());
        assertTrue(report.getRotationsDue().isEmpty());
        assertFalse(report.getKeysByPurpose().containsKey(KeyPurpose.KEY_WRAPPING));
        assertEquals(4, ctx.publishedEventsOf(KeyLifecycleEvent.class).size());
    }

    @Test
    void generate_key_returns_the_active_key() {
        KeyMetadata first = kms.generateKey(KeyPurpose.CJI_DATA);
        KeyMetadata second = kms.generateKey(KeyPurpose.CJI_DATA);

        assertEquals(first.getId(), second.getId());
        assertEquals(KeyStatus.ACTIVE, first.getStatus());
        assertEquals("AES-256", first.getAlgorithm());
        assertEquals(16, first.getFingerprint().length());
        assertEquals("HMAC-SHA256", kms.generateKey(KeyPurpose.INTEGRITY_SIGNING).getAlgorithm());
    }

    @Test
    void concurrent_generate_key_yields_one_key() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> calls = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                calls.add(() -> kms.generateKey(KeyPurpose.SENSITIVE_DATA).getId());
            }
            Set<String> ids = new HashSet<>();
            for (Future<String> result : pool.invokeAll(calls)) {
                ids.add(result.get());
            }
            assertEquals(1, ids.size());
            assertEquals(4, kms.keyReport().getTotalKeys());
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void wrapping_purpose_is_not_issuable() {
        assertThrows(ValidationException.class, () -> kms.generateKey(KeyPurpose.KEY_WRAPPING));
        assertThrows(ValidationException.class, () -> kms.rotateKey(KeyPurpose.KEY_WRAPPING, "no"));
    }

    @Test
    void rotation_retires_previous_key() {
        String previous = kms.activeKey(KeyPurpose.PUBLIC_DATA).keyId();

        KeyMetadata rotated = kms.rotateKey(KeyPurpose.PUBLIC_DATA, "compromise drill");

        assertNotEquals(previous, rotated.getId());
        assertEquals(2, rotated.getKeyVersion());
        assertEquals(KeyStatus.RETIRED, kms.findKeyMetadata(previous).orElseThrow().getStatus());
        assertEquals(rotated.getId(), kms.activeKey(KeyPurpose.PUBLIC_DATA).keyId());
        assertEquals(1, ctx.getAuditRepository().ofType(AuditEventTypes.KEY_ROTATED).size());
    }

    @Test
    void revoked_key_is_unreachable_and_replaced() {
        EncryptionEnvelope envelope = ctx.getCrypto().encrypt("x".getBytes(StandardCharsets.UTF_8),
            DataClassification.SENSITIVE, "field.a");

        kms.revokeKey(envelope.getKeyId(), "key exposed");

        assertThrows(KeyNotFoundException.class, () -> kms.getKey(envelope.getKeyId()));
        assertThrows(KeyNotFoundException.class, () -> ctx.getCrypto().decrypt(envelope, "field.a"));
        String replacement = kms.activeKey(KeyPurpose.SENSITIVE_DATA).keyId();
        assertNotEquals(envelope.getKeyId(), replacement);
        assertEquals(1, ctx.getAuditRepository().ofType(AuditEventTypes.KEY_REVOKED).size());
    }

    @Test
    void revoking_unknown_key_fails() {
        assertThrows(KeyNotFoundException.class, () -> kms.revokeKey("public_data-v9-0000000000000000", "none"));
        assertThrows(KeyNotFoundException.class, () -> kms.getKey(" "));
    }

    @Test
    void scheduled_rotation_replaces_keys_past_due() {
        ctx.getClock().advance(Duration.ofDays(85));
        assertEquals(4, kms.keyReport().getRotationsDue().size());
        assertTrue(kms.rotateDueKeys().isEmpty());

        ctx.getClock().advance(Duration.ofDays(6));
        List<KeyMetadata> rotated = kms.rotateDueKeys();

        assertEquals(4, rotated.size());
        assertEquals(4, kms.keyReport().getRetiredKeys());
        assertTrue(kms.keyReport().getRotationsDue().isEmpty());
    }

    @Test
    void restart_reloads_stored_keys() {
        EncryptionEnvelope envelope = ctx.getCrypto().encrypt("kept".getBytes(StandardCharsets.UTF_8),
            DataClassification.CJI, "restart.check");

        PersistentKeyManagementService restarted = restart(ctx.getKeyRepository(), ComplianceTestContext.ROOT_SECRET);
        AesGcmCryptoService crypto = new AesGcmCryptoService(restarted, ctx.getProperties(), event -> { },
            ctx.getClock());

        assertEquals(envelope.getKeyId(), restarted.activeKey(KeyPurpose.CJI_DATA).keyId());
        assertEquals("kept", new String(crypto.decrypt(envelope, "restart.check"), StandardCharsets.UTF_8));
        assertEquals(4, restarted.keyReport().getTotalKeys());
    }

    @Test
    void restart_with_wrong_root_secret_refuses_to_start() {
        String wrongSecret = "ff".repeat(32);

        assertThrows(IllegalStateException.class, () -> restart(ctx.getKeyRepository(), wrongSecret));
    }

    @Test
    void missing_root_secret_refuses_to_start() {
        assertThrows(IllegalStateException.class, () -> restart(new InMemoryCryptoKeyRepository(), null));
        assertThrows(IllegalStateException.class, () -> restart(new InMemoryCryptoKeyRepository(), "c2hvcnQ="));
    }

    @Test
    void operations_before_initialization_fail() {
        ComplianceProperties properties = new ComplianceProperties();
        properties.getCrypto().setRootSecret(ComplianceTestContext.ROOT_SECRET);
        PersistentKeyManagementService uninitialized = new PersistentKeyManagementService(
            new InMemoryCryptoKeyRepository(), properties, new CacheConfiguration().cacheManager(),
            event -> { }, new MutableClock(ComplianceTestContext.START));

        assertThrows(IllegalStateException.class, () -> uninitialized.activeKey(KeyPurpose.CJI_DATA));
        assertTrue(uninitialized.rotateDueKeys().isEmpty());
    }

    @Test
    void revocation_racing_a_cache_fill_leaves_the_key_unreachable() {
        String retiredId = kms.activeKey(KeyPurpose.CJI_DATA).keyId();
        kms.rotateKey(KeyPurpose.CJI_DATA, "scheduled");

        HookedCache cache = new HookedCache();
        SimpleCacheManager cacheManager = new SimpleCacheManager();
        cacheManager.setCaches(List.of(cache));
        cacheManager.afterPropertiesSet();
        PersistentKeyManagementService restarted = new PersistentKeyManagementService(ctx.getKeyRepository(),
            ctx.getProperties(), cacheManager, event -> { }, ctx.getClock());
        restarted.initialize();
        cache.clear();

        // The revocation lands after the record was read but before the material is cached.
        cache.beforeNextPut(() -> restarted.revokeKey(retiredId, "compromised"));

        assertThrows(KeyNotFoundException.class, () -> restarted.getKey(retiredId));
        assertNull(cache.get(retiredId));
        assertThrows(KeyNotFoundException.class, () -> restarted.getKey(retiredId));
    }

    private PersistentKeyManagementService restart(InMemoryCryptoKeyRepository repository, String rootSecret) {
        ComplianceProperties properties = new ComplianceProperties();
        properties.getCrypto().setRootSecret(rootSecret);
        PersistentKeyManagementService service = new PersistentKeyManagementService(repository, properties,
            new CacheConfiguration().cacheManager(), event -> { }, ctx.getClock());
        service.initialize();
        return service;
    }

    private static final class HookedCache extends ConcurrentMapCache {

        private Runnable beforePut;

        HookedCache() {
            super(PersistentKeyManagementService.KEY_MATERIAL_CACHE);
        }

        void beforeNextPut(Runnable action) {
            this.beforePut = action;
        }

        @Override
        public void put(Object key, Object value) {
            Runnable action = beforePut;
            beforePut = null;
            if (action != null) {
                action.run();
            }
            super.put(key, value);
        }
    }
}
