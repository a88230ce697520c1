package com.httpcache.service.key;

import com.httpcache.model.RequestParts;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives cache keys as {@code "{METHOD}:{URI}"}, or through a configured override.
 *
 * Example: GET http://example.com/ → {@code GET:http://example.com/}
 */
@Slf4j
public class CacheKeyDeriver {

    private static final String SEPARATOR = ":";

    /**
     * Default derivation, usable as a {@link CacheKeyFunction} on its own.
     */
    public static final CacheKeyFunction DEFAULT = parts ->
            parts.getMethod().name() + SEPARATOR + parts.getUri();

    private final CacheKeyFunction function;

    public CacheKeyDeriver() {
        this(null);
    }

    /**
     * @param override key function replacing the default, or null for the default
     */
    public CacheKeyDeriver(CacheKeyFunction override) {
        this.function = override != null ? override : DEFAULT;
        if (override != null) {
            log.debug("Using custom cache key function");
        }
    }

    public String derive(RequestParts parts) {
        return function.apply(parts);
    }
}
