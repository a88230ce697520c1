package com.httpcache.support;

import com.httpcache.model.FreshnessPolicy;
import com.httpcache.model.HttpResponseRecord;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for stored responses and policies used across tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static HttpResponseRecord response(String url, String body) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("content-type", "text/plain");
        headers.put("cache-control", "max-age=60");
        return HttpResponseRecord.builder()
                .status(200)
                .headers(headers)
                .body(body.getBytes(StandardCharsets.UTF_8))
                .url(URI.create(url))
                .build();
    }

    /**
     * Policy for a response received at {@code responseTime} with the given lifetime.
     */
    public static FreshnessPolicy policy(Instant responseTime, long lifetimeSeconds) {
        return policy(responseTime, 0, lifetimeSeconds);
    }

    public static FreshnessPolicy policy(Instant responseTime, long initialAgeSeconds, long lifetimeSeconds) {
        return FreshnessPolicy.builder()
                .requestMethod("GET")
                .status(200)
                .shared(true)
                .responseTime(responseTime)
                .initialAgeSeconds(initialAgeSeconds)
                .lifetimeSeconds(lifetimeSeconds)
                .build();
    }

    public static String key(String url) {
        return "GET:" + url;
    }
}
