package com.httpcache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters of one cache filter, plus the size of its backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Backend name (memory, indexed, redis).
     */
    private String backend;

    /**
     * Configured default cache mode.
     */
    private String mode;

    /**
     * Stored entries, or -1 if the backend could not be asked.
     */
    private long entries;

    /**
     * Responses served from storage without contacting the origin.
     */
    private long hits;

    /**
     * Requests answered by a full origin fetch.
     */
    private long misses;

    /**
     * Stale entries confirmed by a 304.
     */
    private long revalidations;

    private long stores;

    private long storageErrors;

    /**
     * Cache hit rate (0.0-1.0) over hits, misses and revalidations.
     */
    private double hitRate;
}
