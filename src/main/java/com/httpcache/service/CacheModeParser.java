package com.httpcache.service;

import com.httpcache.model.CacheHeaders;
import com.httpcache.model.CacheMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.util.Optional;

/**
 * Parses the per-request cache mode override header.
 *
 * Lets a caller pick a mode for one request, e.g.
 * {@code x-http-cache-mode: no-cache} forces a trip to the origin.
 */
@Slf4j
public class CacheModeParser {

    /**
     * Parse cache mode from HTTP headers.
     *
     * @param headers HTTP request headers
     * @return requested mode, or empty if the header is absent or invalid
     */
    public Optional<CacheMode> parse(HttpHeaders headers) {
        String mode = headers.getFirst(CacheHeaders.CACHE_MODE);
        if (mode == null || mode.isBlank()) {
            return Optional.empty();
        }

        String normalized = mode.trim().replace('-', '_').toUpperCase();

        try {
            CacheMode parsed = CacheMode.valueOf(normalized);
            log.debug("Cache mode override via header: {}", parsed);
            return Optional.of(parsed);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid cache mode: {}, using configured mode", mode);
            return Optional.empty();
        }
    }
}
