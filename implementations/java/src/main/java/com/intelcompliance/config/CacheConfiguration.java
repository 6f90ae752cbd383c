package com.intelcompliance.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine caching.
 *
 * Security:
 * - Key material is cached unwrapped, in process memory only
 * - Short idle expiry so unused keys drop out of the heap
 * - Revocation evicts explicitly; expiry is not relied on for it
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfiguration {

    public static final String KEY_MATERIAL_CACHE = "keyMaterial";

    @Bean
    public CacheManager cacheManager() {
        log.info("Configuring Caffeine cache for key material");

        CaffeineCacheManager cacheManager = new CaffeineCacheManager();

        cacheManager.setCaffeine(Caffeine.newBuilder()
            .maximumSize(1_000)  // A few keys per purpose and version
            .expireAfterAccess(30, TimeUnit.MINUTES)
            .recordStats()
        );

        cacheManager.setCacheNames(List.of(KEY_MATERIAL_CACHE));
        // No null values: a miss always falls through to the key store
        cacheManager.setAllowNullValues(false);

        return cacheManager;
    }
}
