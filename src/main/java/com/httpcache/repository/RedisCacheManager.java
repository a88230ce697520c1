package com.httpcache.repository;

import com.httpcache.model.FreshnessPolicy;
import com.httpcache.model.HttpResponseRecord;
import com.httpcache.model.StoredEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.Optional;
import java.util.Set;

/**
 * Redis-based cache manager with compression.
 * Key pattern: httpcache:{namespace}:{cacheKey}
 *
 * Entries carry no Redis TTL: staleness is judged on read, and removal only
 * happens through delete or clear.
 */
@Slf4j
public class RedisCacheManager implements CacheManager {

    private static final String KEY_PREFIX = "httpcache:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final EntryCodec codec;
    private final String prefix;

    public RedisCacheManager(RedisTemplate<String, byte[]> redisTemplate, EntryCodec codec, String namespace) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.prefix = KEY_PREFIX + namespace + ":";
    }

    /**
     * Get stored entry by cache key.
     *
     * A record that cannot be decoded is treated as absent.
     */
    @Override
    public Optional<StoredEntry> get(String key) {
        String redisKey = buildKey(key);
        byte[] compressed;
        try {
            compressed = redisTemplate.opsForValue().get(redisKey);
        } catch (DataAccessException e) {
            throw new CacheStorageException("Error retrieving from Redis cache: key=" + key, e);
        }

        if (compressed == null) {
            log.debug("Redis cache miss: {}", redisKey);
            return Optional.empty();
        }

        try {
            return Optional.of(codec.decode(compressed));
        } catch (CacheSerializationException e) {
            log.warn("Unreadable Redis cache entry, treating as absent: {}", redisKey, e);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, HttpResponseRecord response, FreshnessPolicy policy) {
        String redisKey = buildKey(key);
        byte[] compressed = codec.encode(StoredEntry.builder()
                .key(key)
                .response(response)
                .policy(policy)
                .build());
        try {
            redisTemplate.opsForValue().set(redisKey, compressed);
        } catch (DataAccessException e) {
            throw new CacheStorageException("Error storing to Redis cache: key=" + key, e);
        }
        log.debug("Stored in Redis cache: key={}, size={}KB", redisKey, compressed.length / 1024);
    }

    @Override
    public void delete(String key) {
        String redisKey = buildKey(key);
        try {
            redisTemplate.delete(redisKey);
            log.debug("Deleted from Redis cache: {}", redisKey);
        } catch (DataAccessException e) {
            throw new CacheStorageException("Error deleting from Redis cache: key=" + key, e);
        }
    }

    /**
     * Clear all entries of this namespace.
     */
    @Override
    public void clear() {
        try {
            Set<String> keys = redisTemplate.keys(prefix + "*");
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
                log.info("Cleared {} entries from Redis cache", keys.size());
            }
        } catch (DataAccessException e) {
            throw new CacheStorageException("Error clearing Redis cache", e);
        }
    }

    @Override
    public long size() {
        try {
            Set<String> keys = redisTemplate.keys(prefix + "*");
            return keys != null ? keys.size() : 0;
        } catch (DataAccessException e) {
            throw new CacheStorageException("Error counting Redis cache entries", e);
        }
    }

    @Override
    public String getName() {
        return "redis";
    }

    /**
     * Build Redis key from namespace and cache key.
     */
    private String buildKey(String key) {
        return prefix + key;
    }
}
