package com.httpcache.model;

/**
 * Per-request policy for how the cache talks to the origin.
 */
public enum CacheMode {

    /**
     * Serve fresh entries, revalidate stale ones, store what the headers allow.
     */
    DEFAULT,

    /**
     * Bypass the cache entirely: no lookup, no write.
     */
    NO_STORE,

    /**
     * Always go to the origin, but still write the response through.
     */
    NO_CACHE,

    /**
     * Serve any stored entry regardless of staleness; fetch only on a miss.
     */
    FORCE_CACHE,

    /**
     * Serve any stored entry; never contact the origin. A miss yields 504.
     */
    ONLY_IF_CACHED,

    /**
     * Like {@link #FORCE_CACHE}, and store every response whatever its headers say.
     */
    IGNORE_RULES;

    public boolean readsStorage() {
        return this != NO_STORE;
    }

    public boolean servesStale() {
        return this == FORCE_CACHE || this == ONLY_IF_CACHED || this == IGNORE_RULES;
    }
}
