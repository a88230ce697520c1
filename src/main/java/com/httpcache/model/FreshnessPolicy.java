package com.httpcache.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Write-time snapshot of the inputs that decide how long a response stays fresh.
 *
 * Nothing here records whether the response is fresh: age, time-to-live and
 * freshness are recomputed for the instant they are asked about.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FreshnessPolicy {

    // About 31 700 years; keeps millisecond arithmetic on instants clear of overflow
    private static final long MAX_SECONDS = 1_000_000_000_000L;

    /**
     * Method of the request that produced the response.
     */
    String requestMethod;

    int status;

    /**
     * Whether the policy was computed with shared (public) cache rules.
     */
    boolean shared;

    /**
     * When the response was received, or last revalidated.
     */
    Instant responseTime;

    /**
     * Corrected age of the response at {@link #responseTime}, in seconds.
     */
    long initialAgeSeconds;

    long lifetimeSeconds;

    /**
     * True when the lifetime came from the Last-Modified heuristic.
     */
    boolean heuristic;

    String etag;

    String lastModified;

    /**
     * Raw Date header of the response.
     */
    String servedDate;

    boolean noCache;

    boolean mustRevalidate;

    boolean immutable;

    /**
     * Instant the response was generated at the origin, per the age calculation.
     */
    public Instant birth() {
        return Instant.ofEpochMilli(birthMillis());
    }

    public Instant expiresAt() {
        return Instant.ofEpochMilli(expiryMillis());
    }

    /**
     * Birth in epoch milliseconds; second counts are bounded so the result never overflows.
     */
    public long birthMillis() {
        return responseTime.toEpochMilli() - bounded(initialAgeSeconds) * 1000L;
    }

    public long expiryMillis() {
        return birthMillis() + bounded(lifetimeSeconds) * 1000L;
    }

    /**
     * Age in whole seconds. Negative only if {@code now} precedes the response.
     */
    public long ageAt(Instant now) {
        return Math.floorDiv(now.toEpochMilli() - birthMillis(), 1000L);
    }

    /**
     * Remaining freshness in seconds; zero or negative once stale.
     */
    public long timeToLiveAt(Instant now) {
        return bounded(lifetimeSeconds) - ageAt(now);
    }

    public boolean isFreshAt(Instant now) {
        return ageAt(now) < bounded(lifetimeSeconds);
    }

    public boolean hasValidator() {
        return etag != null || lastModified != null;
    }

    private static long bounded(long seconds) {
        return Math.max(-MAX_SECONDS, Math.min(MAX_SECONDS, seconds));
    }
}
