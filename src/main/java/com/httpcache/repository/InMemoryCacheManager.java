package com.httpcache.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.httpcache.model.FreshnessPolicy;
import com.httpcache.model.HttpResponseRecord;
import com.httpcache.model.StoredEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed cache manager. Entries live only as long as the process.
 */
@Slf4j
public class InMemoryCacheManager implements CacheManager {

    private final Cache<String, StoredEntry> cache;

    public InMemoryCacheManager() {
        this(Caffeine.newBuilder().build());
    }

    /**
     * @param maxSize          entry bound, or a non-positive value for none
     * @param expireAfterWrite retention bound, or null for none
     */
    public InMemoryCacheManager(long maxSize, Duration expireAfterWrite) {
        this(caffeineCacheBuilder(maxSize, expireAfterWrite).build());
    }

    InMemoryCacheManager(Cache<String, StoredEntry> cache) {
        this.cache = cache;
    }

    private static Caffeine<Object, Object> caffeineCacheBuilder(long maxSize, Duration expireAfterWrite) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (maxSize > 0) {
            builder.maximumSize(maxSize);
        }
        if (expireAfterWrite != null) {
            builder.expireAfterWrite(expireAfterWrite);
        }
        return builder;
    }

    @Override
    public Optional<StoredEntry> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, HttpResponseRecord response, FreshnessPolicy policy) {
        cache.put(key, StoredEntry.builder()
                .key(key)
                .response(response)
                .policy(policy)
                .build());
        log.debug("Stored in memory cache: key={}", key);
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public void clear() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        log.info("Cleared {} entries from memory cache", size);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public String getName() {
        return "memory";
    }
}
