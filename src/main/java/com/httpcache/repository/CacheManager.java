package com.httpcache.repository;

import com.httpcache.model.FreshnessPolicy;
import com.httpcache.model.HttpResponseRecord;
import com.httpcache.model.StoredEntry;

import java.util.Optional;

/**
 * Storage contract shared by every cache backend.
 *
 * Backends never judge freshness: {@link #get} returns whatever is stored.
 * All operations are safe for concurrent callers, and a reader never observes
 * a partially written entry.
 */
public interface CacheManager {

    /**
     * @param key cache key
     * @return the stored entry, or empty if absent
     * @throws CacheStorageException on backend failure
     */
    Optional<StoredEntry> get(String key);

    /**
     * Store an entry, replacing any previous one under the same key.
     *
     * @throws CacheStorageException on backend failure
     */
    void put(String key, HttpResponseRecord response, FreshnessPolicy policy);

    /**
     * Remove an entry. Deleting an absent key succeeds.
     *
     * @throws CacheStorageException on backend failure
     */
    void delete(String key);

    /**
     * Remove every entry.
     */
    void clear();

    /**
     * Number of stored entries, possibly approximate.
     */
    long size();

    /**
     * Short backend name for logs and statistics.
     */
    String getName();
}
