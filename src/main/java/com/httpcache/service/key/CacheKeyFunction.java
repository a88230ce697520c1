package com.httpcache.service.key;

import com.httpcache.model.RequestParts;

/**
 * Maps a request to the key its response is stored under.
 *
 * Implementations must be pure: two semantically identical requests yield the same key.
 */
@FunctionalInterface
public interface CacheKeyFunction {

    String apply(RequestParts parts);
}
