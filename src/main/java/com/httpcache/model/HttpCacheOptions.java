package com.httpcache.model;

import com.httpcache.service.key.CacheKeyFunction;
import lombok.Builder;
import lombok.Value;

import java.util.function.Function;

/**
 * Per-filter cache options.
 */
@Value
@Builder
public class HttpCacheOptions {

    /**
     * Replaces the default {@code "{METHOD}:{URI}"} key derivation when set.
     */
    CacheKeyFunction cacheKey;

    /**
     * Shared (public) cache semantics when true, private cache semantics when false.
     */
    @Builder.Default
    boolean shared = true;

    /**
     * Picks the mode per request; a null result falls back to the configured mode.
     */
    Function<RequestParts, CacheMode> cacheModeFn;

    /**
     * Largest response body, in bytes, that is buffered for storage. Larger
     * responses are still delivered, just never stored.
     */
    @Builder.Default
    long maxBodySize = 10L * 1024 * 1024;

    public static HttpCacheOptions defaults() {
        return HttpCacheOptions.builder().build();
    }
}
