package com.httpcache.model;

/**
 * Header names the cache reads from requests or adds to responses.
 */
public class CacheHeaders {

    // ========== Request Control Headers ==========

    /**
     * Per-request cache mode override, stripped before the request leaves.
     * Values: default, no-store, no-cache, force-cache, only-if-cached, ignore-rules
     *
     * Example: x-http-cache-mode: no-cache
     */
    public static final String CACHE_MODE = "x-http-cache-mode";

    // ========== Response Provenance Headers ==========

    /**
     * Whether the response body came from storage.
     * Values: "HIT" or "MISS"
     */
    public static final String CACHE = "x-cache";

    /**
     * Whether a stored entry existed for the request, used or not.
     * Values: "HIT" or "MISS"
     */
    public static final String CACHE_LOOKUP = "x-cache-lookup";

    public static final String HIT = "HIT";

    public static final String MISS = "MISS";

    private CacheHeaders() {
        // Utility class, no instantiation
    }
}
