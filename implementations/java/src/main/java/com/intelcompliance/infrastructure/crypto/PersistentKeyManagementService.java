package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.config.CacheConfiguration;
import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.domain.exception.CryptoException;
import com.intelcompliance.domain.exception.KeyNotFoundException;
import com.intelcompliance.domain.exception.ValidationException;
import com.intelcompliance.domain.model.CryptoKey;
import com.intelcompliance.domain.model.KeyMetadata;
import com.intelcompliance.domain.model.KeyPurpose;
import com.intelcompliance.domain.model.KeyStatus;
import com.intelcompliance.domain.repository.CryptoKeyRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Key management backed by the {@code crypto_keys} table.
 *
 * <p>Architecture:
 * <ul>
 *   <li>Root secret supplied by configuration (never persisted)</li>
 *   <li>Data and signing keys generated here, stored wrapped under the root key</li>
 *   <li>Unwrapped material held in the {@code keyMaterial} cache</li>
 *   <li>Active key per purpose tracked by {@link ActiveKeyRegistry}</li>
 * </ul>
 *
 * <p>Security properties:
 * <ul>
 *   <li>Retired keys decrypt legacy data but never encrypt new data</li>
 *   <li>Revoked keys are unreachable: lookups fail with not-found</li>
 *   <li>Wrapped blobs are bound to their key id and purpose</li>
 * </ul>
 */
@Service
@Slf4j
public class PersistentKeyManagementService implements KeyManagementService {

    static final String KEY_MATERIAL_CACHE = CacheConfiguration.KEY_MATERIAL_CACHE;

    private static final int AES_KEY_SIZE = 256;
    private static final String AES_ALGORITHM = "AES-256";
    private static final String HMAC_ALGORITHM = "HMAC-SHA256";

    private static final List<KeyPurpose> ISSUABLE = Arrays.stream(KeyPurpose.values())
        .filter(KeyPurpose::isIssuable)
        .collect(Collectors.toList());

    private final CryptoKeyRepository keyRepository;
    private final ComplianceProperties properties;
    private final Cache keyMaterialCache;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final ActiveKeyRegistry registry = new ActiveKeyRegistry();
    private final SecureRandom secureRandom = new SecureRandom();

    private volatile RootKeyWrapper rootKeyWrapper;

    public PersistentKeyManagementService(CryptoKeyRepository keyRepository,
                                          ComplianceProperties properties,
                                          CacheManager cacheManager,
                                          ApplicationEventPublisher eventPublisher,
                                          Clock clock) {
        this.keyRepository = keyRepository;
        this.properties = properties;
        this.keyMaterialCache = cacheManager.getCache(KEY_MATERIAL_CACHE);
        if (this.keyMaterialCache == null) {
            throw new IllegalStateException("Cache '" + KEY_MATERIAL_CACHE + "' is not configured");
        }
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    @PostConstruct
    public synchronized void initialize() {
        if (rootKeyWrapper != null) {
            return;
        }
        byte[] rootSecret = RootKeyWrapper.decodeSecret(properties.getCrypto().getRootSecret());
        RootKeyWrapper wrapper = new RootKeyWrapper(rootSecret, secureRandom);
        Arrays.fill(rootSecret, (byte) 0);

        int loaded = 0;
        for (CryptoKey key : keyRepository.findAll()) {
            if (key.isRevoked()) {
                continue;
            }
            // Any stored key that fails to unwrap means a wrong root secret or tampering.
            try {
                keyMaterialCache.put(key.getId(), unwrapAndVerify(wrapper, key));
            } catch (CryptoException e) {
                throw new IllegalStateException("Stored key " + key.getId() + " failed verification", e);
            }
            loaded++;
        }
        this.rootKeyWrapper = wrapper;

        for (KeyPurpose purpose : ISSUABLE) {
            registry.exclusive(purpose, () -> {
                keyRepository.findByPurposeAndStatus(purpose, KeyStatus.ACTIVE).stream()
                    .findFirst()
                    .ifPresent(key -> registry.activate(purpose, key.getId()));
                return null;
            });
            generateKey(purpose);
        }

        log.info("Key management initialized: {} stored keys loaded, {} purposes active",
            loaded, ISSUABLE.size());
    }

    @Override
    public KeyMetadata generateKey(KeyPurpose purpose) {
        requireInitialized();
        requireIssuable(purpose);
        CreatedKey created = registry.exclusive(purpose, () -> {
            String existing = registry.peek(purpose);
            if (existing != null) {
                return new CreatedKey(loadRecord(existing).toMetadata(), false);
            }
            CryptoKey key = createKey(purpose, nextVersion(purpose));
            registry.activate(purpose, key.getId());
            return new CreatedKey(key.toMetadata(), true);
        });

        if (created.isNew()) {
            log.info("KEY CREATED purpose={} keyId={}", purpose, created.metadata().getId());
            eventPublisher.publishEvent(new KeyLifecycleEvent(KeyLifecycleEvent.Action.CREATED,
                created.metadata().getId(), purpose, null, "bootstrap", clock.instant()));
        }
        return created.metadata();
    }

    @Override
    public KeyHandle getKey(String keyId) {
        requireInitialized();
        if (keyId == null || keyId.isBlank()) {
            throw new KeyNotFoundException(String.valueOf(keyId));
        }
        SecretKey cached = keyMaterialCache.get(keyId, SecretKey.class);
        if (cached != null) {
            // Revocation evicts; a cached entry is never revoked.
            return new KeyHandle(keyId, purposeOf(keyId), cached);
        }

        CryptoKey key = keyRepository.findById(keyId)
            .filter(k -> !k.isRevoked())
            .orElseThrow(() -> new KeyNotFoundException(keyId));
        SecretKey material = unwrapAndVerify(rootKeyWrapper, key);
        keyMaterialCache.put(keyId, material);
        // A revocation that evicted between the load and the put must not leave material behind.
        if (keyRepository.findById(keyId).map(CryptoKey::isRevoked).orElse(true)) {
            keyMaterialCache.evict(keyId);
            throw new KeyNotFoundException(keyId);
        }
        return new KeyHandle(keyId, key.getPurpose(), material);
    }

    @Override
    public KeyHandle activeKey(KeyPurpose purpose) {
        requireInitialized();
        Optional<String> active = registry.activeKeyId(purpose);
        if (active.isPresent()) {
            return getKey(active.get());
        }
        return getKey(generateKey(purpose).getId());
    }

    @Override
    public KeyMetadata rotateKey(KeyPurpose purpose, String reason) {
        requireInitialized();
        requireIssuable(purpose);
        Instant now = clock.instant();

        String[] previous = new String[1];
        KeyMetadata rotated = registry.exclusive(purpose, () -> {
            String currentId = registry.peek(purpose);
            int nextVersion = nextVersion(purpose);
            if (currentId != null) {
                CryptoKey current = loadRecord(currentId);
                current.retire(now, reason);
                keyRepository.save(current);
                previous[0] = currentId;
            }
            CryptoKey replacement = createKey(purpose, nextVersion);
            registry.activate(purpose, replacement.getId());
            return replacement.toMetadata();
        });

        log.warn("KEY ROTATION purpose={} retired={} active={} reason={}",
            purpose, previous[0], rotated.getId(), reason);
        eventPublisher.publishEvent(new KeyLifecycleEvent(KeyLifecycleEvent.Action.ROTATED,
            rotated.getId(), purpose, previous[0], reason, now));
        return rotated;
    }

    @Override
    public void revokeKey(String keyId, String reason) {
        requireInitialized();
        CryptoKey key = keyRepository.findById(keyId)
            .orElseThrow(() -> new KeyNotFoundException(keyId));
        if (key.isRevoked()) {
            return;
        }
        KeyPurpose purpose = key.getPurpose();
        Instant now = clock.instant();

        boolean wasActive = registry.exclusive(purpose, () -> {
            CryptoKey current = loadRecord(keyId);
            boolean active = keyId.equals(registry.peek(purpose));
            current.revoke(now, reason);
            keyRepository.save(current);
            keyMaterialCache.evict(keyId);
            registry.deactivate(purpose, keyId);
            return active;
        });

        log.error("KEY REVOKED purpose={} keyId={} reason={}", purpose, keyId, reason);
        eventPublisher.publishEvent(new KeyLifecycleEvent(KeyLifecycleEvent.Action.REVOKED,
            keyId, purpose, null, reason, now));

        if (wasActive) {
            generateKey(purpose);
        }
    }

    @Override
    @Scheduled(cron = "${compliance.crypto.rotation-cron:0 0 2 * * *}")
    public List<KeyMetadata> rotateDueKeys() {
        if (rootKeyWrapper == null) {
            return List.of();
        }
        Instant now = clock.instant();
        List<KeyMetadata> rotated = new ArrayList<>();
        for (KeyPurpose purpose : ISSUABLE) {
            Optional<String> activeId = registry.activeKeyId(purpose);
            if (activeId.isEmpty()) {
                continue;
            }
            CryptoKey active = loadRecord(activeId.get());
            if (active.isRotationDue(now)) {
                rotated.add(rotateKey(purpose, "scheduled rotation"));
            }
        }
        if (!rotated.isEmpty()) {
            log.info("Scheduled key rotation completed: {} keys rotated", rotated.size());
        }
        return rotated;
    }

    @Override
    public Optional<KeyMetadata> findKeyMetadata(String keyId) {
        return keyRepository.findById(keyId).map(CryptoKey::toMetadata);
    }

    @Override
    public KeyReport keyReport() {
        Instant now = clock.instant();
        Instant warningHorizon = now.plus(properties.getCrypto().getRotationWarning());
        List<CryptoKey> keys = keyRepository.findAll();
        List<CryptoKey> active = keys.stream().filter(CryptoKey::isActive).collect(Collectors.toList());

        Map<KeyPurpose, Long> byPurpose = new EnumMap<>(KeyPurpose.class);
        for (CryptoKey key : keys) {
            byPurpose.merge(key.getPurpose(), 1L, Long::sum);
        }

        return KeyReport.builder()
            .totalKeys(keys.size())
            .activeKeys(active.size())
            .retiredKeys(keys.stream().filter(k -> k.getStatus() == KeyStatus.RETIRED).count())
            .revokedKeys(keys.stream().filter(CryptoKey::isRevoked).count())
            .rotationsDue(active.stream()
                .filter(k -> k.getRotationDueAt().isBefore(warningHorizon))
                .sorted(Comparator.comparing(CryptoKey::getRotationDueAt))
                .map(CryptoKey::toMetadata)
                .collect(Collectors.toList()))
            .keysByPurpose(byPurpose)
            .oldestActiveKey(active.stream().min(Comparator.comparing(CryptoKey::getCreatedAt))
                .map(CryptoKey::toMetadata).orElse(null))
            .newestActiveKey(active.stream().max(Comparator.comparing(CryptoKey::getCreatedAt))
                .map(CryptoKey::toMetadata).orElse(null))
            .generatedAt(now)
            .build();
    }

    /** Caller must hold the purpose's exclusive lock. */
    private CryptoKey createKey(KeyPurpose purpose, int version) {
        Instant now = clock.instant();
        String keyId = purpose.name().toLowerCase(Locale.ROOT) + "-v" + version + "-"
            + UUID.randomUUID().toString().replace("-", "").substring(0, 16);

        byte[] material = generateMaterial();
        try {
            RootKeyWrapper.WrappedKey wrapped = rootKeyWrapper.wrap(material, keyId, purpose.name());
            CryptoKey key = CryptoKey.create(keyId, purpose,
                purpose.isEncryptionPurpose() ? AES_ALGORITHM : HMAC_ALGORITHM,
                wrapped.ciphertext(), wrapped.iv(), fingerprint(material), version, now,
                now.plus(properties.getCrypto().getKeyRotationInterval()));
            keyRepository.save(key);
            keyMaterialCache.put(keyId, toSecretKey(purpose, material));
            return key;
        } finally {
            Arrays.fill(material, (byte) 0);
        }
    }

    private static void requireIssuable(KeyPurpose purpose) {
        if (purpose == null || !purpose.isIssuable()) {
            throw new ValidationException("purpose", "is not an issuable key purpose: " + purpose);
        }
    }

    private int nextVersion(KeyPurpose purpose) {
        return keyRepository.findAll().stream()
            .filter(k -> k.getPurpose() == purpose)
            .mapToInt(CryptoKey::getKeyVersion)
            .max()
            .orElse(0) + 1;
    }

    private CryptoKey loadRecord(String keyId) {
        return keyRepository.findById(keyId).orElseThrow(() -> new KeyNotFoundException(keyId));
    }

    private KeyPurpose purposeOf(String keyId) {
        for (KeyPurpose purpose : KeyPurpose.values()) {
            if (keyId.startsWith(purpose.name().toLowerCase(Locale.ROOT) + "-")) {
                return purpose;
            }
        }
        return loadRecord(keyId).getPurpose();
    }

    private SecretKey unwrapAndVerify(RootKeyWrapper wrapper, CryptoKey key) {
        byte[] material = wrapper.unwrap(key.getWrappedMaterial(), key.getWrapIv(),
            key.getId(), key.getPurpose().name());
        try {
            if (!MessageDigest.isEqual(
                    fingerprint(material).getBytes(), key.getFingerprint().getBytes())) {
                throw new CryptoException("Key integrity check failed for " + key.getId());
            }
            return toSecretKey(key.getPurpose(), material);
        } finally {
            Arrays.fill(material, (byte) 0);
        }
    }

    private byte[] generateMaterial() {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance("AES");
            keyGen.init(AES_KEY_SIZE, secureRandom);
            return keyGen.generateKey().getEncoded();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to generate key material", e);
        }
    }

    private static SecretKey toSecretKey(KeyPurpose purpose, byte[] material) {
        return new SecretKeySpec(material, purpose.isEncryptionPurpose() ? "AES" : "HmacSHA256");
    }

    private static String fingerprint(byte[] material) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(material));
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoException("SHA-256 unavailable", e);
        }
    }

    private void requireInitialized() {
        if (rootKeyWrapper == null) {
            throw new IllegalStateException("Key management service is not initialized");
        }
    }

    private record CreatedKey(KeyMetadata metadata, boolean isNew) {}
}
