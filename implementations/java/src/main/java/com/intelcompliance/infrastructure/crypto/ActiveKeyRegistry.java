package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.domain.model.KeyPurpose;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The only global mutable state of the key management service: which key is
 * active for each purpose.
 *
 * <p>Each purpose has its own read/write lock. Lookups take the read lock and
 * key creation or rotation takes the write lock, so no caller ever observes a
 * purpose mid-rotation and rotations of different purposes do not contend.
 */
final class ActiveKeyRegistry {

    private final Map<KeyPurpose, String> activeKeyIds = new ConcurrentHashMap<>();
    private final Map<KeyPurpose, ReadWriteLock> locks = new EnumMap<>(KeyPurpose.class);

    ActiveKeyRegistry() {
        for (KeyPurpose purpose : KeyPurpose.values()) {
            locks.put(purpose, new ReentrantReadWriteLock());
        }
    }

    Optional<String> activeKeyId(KeyPurpose purpose) {
        return read(purpose, () -> Optional.ofNullable(activeKeyIds.get(purpose)));
    }

    <T> T read(KeyPurpose purpose, Supplier<T> action) {
        ReadWriteLock lock = locks.get(purpose);
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs {@code action} holding the purpose's exclusive lock.
     */
    <T> T exclusive(KeyPurpose purpose, Supplier<T> action) {
        ReadWriteLock lock = locks.get(purpose);
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Caller must hold the purpose's exclusive lock. */
    void activate(KeyPurpose purpose, String keyId) {
        activeKeyIds.put(purpose, keyId);
    }

    /** Caller must hold the purpose's exclusive lock. */
    void deactivate(KeyPurpose purpose, String keyId) {
        activeKeyIds.remove(purpose, keyId);
    }

    /** Caller must hold the purpose's exclusive lock. */
    String peek(KeyPurpose purpose) {
        return activeKeyIds.get(purpose);
    }
}
