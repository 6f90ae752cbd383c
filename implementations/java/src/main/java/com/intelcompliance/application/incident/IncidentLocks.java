package com.intelcompliance.application.incident;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per incident id. Serialises mutations of the same incident inside
 * this process; the entity's {@code @Version} covers other processes.
 *
 * <p>Locks are weakly held and disappear once no thread references them.
 */
@Component
public class IncidentLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
        .weakValues()
        .build(id -> new ReentrantLock());

    public <T> T withLock(String incidentId, Supplier<T> action) {
        ReentrantLock lock = locks.get(incidentId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
