package com.httpcache.service.policy;

import com.httpcache.model.Freshness;
import com.httpcache.model.FreshnessPolicy;
import com.httpcache.model.HttpResponseRecord;
import com.httpcache.model.RequestParts;
import com.httpcache.model.StoredEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether responses may be stored, for how long they stay fresh, and
 * how stale entries are revalidated.
 *
 * Write time: {@link #assessStorability} turns response headers into a
 * {@link FreshnessPolicy} snapshot. Read time: {@link #evaluate} compares the
 * snapshot against the clock. Revalidation: {@link #buildConditionalRequest}
 * and {@link #mergeRevalidation}.
 */
@Slf4j
public class FreshnessPolicyEngine {

    private static final Set<Integer> UNDERSTOOD_STATUSES =
            Set.of(200, 203, 204, 300, 301, 302, 303, 307, 308, 404, 405, 410, 414, 501);

    private static final Set<Integer> CACHEABLE_BY_DEFAULT =
            Set.of(200, 203, 204, 300, 301, 308, 404, 405, 410, 414, 501);

    // Headers a 304 must not overwrite: they describe the 304's own (empty) body
    private static final Set<String> EXCLUDED_FROM_REVALIDATION_UPDATE =
            Set.of("content-length", "content-encoding", "transfer-encoding", "content-range");

    private final Clock clock;
    private final boolean shared;

    public FreshnessPolicyEngine(Clock clock, boolean shared) {
        this.clock = clock;
        this.shared = shared;
    }

    public boolean isShared() {
        return shared;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Decide whether a response may be stored and snapshot its freshness inputs.
     *
     * @param request  request that produced the response
     * @param response origin response
     * @return the policy, or empty when the response must not be stored
     */
    public Optional<FreshnessPolicy> assessStorability(RequestParts request, HttpResponseRecord response) {
        try {
            String reason = unstorableReason(request, response);
            if (reason != null) {
                log.debug("Not storing {} {} (status {}): {}",
                        request.getMethod(), request.getUri(), response.getStatus(), reason);
                return Optional.empty();
            }
            return Optional.of(snapshot(request, response));
        } catch (PolicyException e) {
            log.debug("Not storing {} {}: {}", request.getMethod(), request.getUri(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Storability check alone; malformed headers count as not storable.
     */
    public boolean isStorable(RequestParts request, HttpResponseRecord response) {
        try {
            return unstorableReason(request, response) == null;
        } catch (PolicyException e) {
            return false;
        }
    }

    /**
     * Compute the policy without the storability gate.
     *
     * @throws PolicyException if Cache-Control is malformed
     */
    public FreshnessPolicy snapshot(RequestParts request, HttpResponseRecord response) {
        Instant responseTime = clock.instant();
        String cacheControlHeader = response.header(HttpHeaders.CACHE_CONTROL);
        CacheControlDirectives cacheControl = CacheControlDirectives.parse(cacheControlHeader);
        long maxAge = cacheControl.seconds("max-age");
        long sharedMaxAge = cacheControl.seconds("s-maxage");

        Instant servedDate = httpDate(response.header(HttpHeaders.DATE));
        Instant lastModified = httpDate(response.header(HttpHeaders.LAST_MODIFIED));
        Instant base = servedDate != null ? servedDate : responseTime;

        boolean noCache = cacheControl.has("no-cache")
                || (cacheControlHeader == null && containsToken(response.header(HttpHeaders.PRAGMA), "no-cache"));

        long lifetime = 0;
        boolean heuristic = false;
        if (noCache) {
            lifetime = 0;
        } else if (shared && sharedMaxAge >= 0) {
            lifetime = sharedMaxAge;
        } else if (maxAge >= 0) {
            lifetime = maxAge;
        } else if (response.header(HttpHeaders.EXPIRES) != null) {
            // An unparsable Expires means "already expired"
            Instant expires = httpDate(response.header(HttpHeaders.EXPIRES));
            lifetime = expires != null
                    ? Math.min(CacheControlDirectives.MAX_DELTA_SECONDS,
                            Math.max(0, Duration.between(base, expires).getSeconds()))
                    : 0;
        } else if (lastModified != null
                && CACHEABLE_BY_DEFAULT.contains(response.getStatus())
                && request.getUri().getRawQuery() == null) {
            long sinceModified = Duration.between(lastModified, base).getSeconds();
            lifetime = sinceModified > 0 ? sinceModified / 10 : 0;
            heuristic = true;
        }

        long apparentAge = servedDate != null
                ? Math.max(0, Duration.between(servedDate, responseTime).getSeconds())
                : 0;
        long initialAge = Math.min(CacheControlDirectives.MAX_DELTA_SECONDS,
                Math.max(apparentAge, ageHeader(response)));

        return FreshnessPolicy.builder()
                .requestMethod(request.getMethod().name())
                .status(response.getStatus())
                .shared(shared)
                .responseTime(responseTime)
                .initialAgeSeconds(initialAge)
                .lifetimeSeconds(lifetime)
                .heuristic(heuristic)
                .etag(response.header(HttpHeaders.ETAG))
                .lastModified(response.header(HttpHeaders.LAST_MODIFIED))
                .servedDate(response.header(HttpHeaders.DATE))
                .noCache(noCache)
                .mustRevalidate(cacheControl.has("must-revalidate"))
                .immutable(cacheControl.has("immutable"))
                .build();
    }

    public Freshness evaluate(FreshnessPolicy policy) {
        return evaluate(policy, clock.instant());
    }

    /**
     * Fresh while the age is below the freshness lifetime; stale otherwise.
     */
    public Freshness evaluate(FreshnessPolicy policy, Instant now) {
        boolean revalidatable = policy.hasValidator();
        return policy.isFreshAt(now) ? Freshness.fresh(revalidatable) : Freshness.stale(revalidatable);
    }

    /**
     * Attach If-None-Match / If-Modified-Since from the stored validators.
     */
    public ClientRequest buildConditionalRequest(ClientRequest base, FreshnessPolicy policy) {
        return ClientRequest.from(base)
                .headers(headers -> {
                    if (policy.getEtag() != null) {
                        headers.set(HttpHeaders.IF_NONE_MATCH, policy.getEtag());
                    }
                    if (policy.getLastModified() != null) {
                        headers.set(HttpHeaders.IF_MODIFIED_SINCE, policy.getLastModified());
                    }
                })
                .build();
    }

    /**
     * Whether a 304 describes the stored representation. A 304 naming a
     * different entity tag (weak comparison) does not.
     */
    public boolean validatorsMatch(StoredEntry stored, HttpResponseRecord notModified) {
        String storedEtag = stored.getResponse().header(HttpHeaders.ETAG);
        String newEtag = notModified.header(HttpHeaders.ETAG);
        if (newEtag != null) {
            return storedEtag != null && weak(storedEtag).equals(weak(newEtag));
        }
        String storedLastModified = stored.getResponse().header(HttpHeaders.LAST_MODIFIED);
        String newLastModified = notModified.header(HttpHeaders.LAST_MODIFIED);
        if (newLastModified != null && storedLastModified != null) {
            return storedLastModified.equals(newLastModified);
        }
        return true;
    }

    /**
     * Fold a 304 into the stored entry: its headers win, status and body are
     * kept, and the freshness clock restarts now.
     */
    public StoredEntry mergeRevalidation(StoredEntry stored, HttpResponseRecord notModified, RequestParts request) {
        Map<String, String> headers = new LinkedHashMap<>(stored.getResponse().getHeaders());
        notModified.getHeaders().forEach((name, value) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (!EXCLUDED_FROM_REVALIDATION_UPDATE.contains(lower)) {
                headers.put(lower, value);
            }
        });
        HttpResponseRecord merged = stored.getResponse().toBuilder()
                .headers(headers)
                .build();

        FreshnessPolicy policy;
        try {
            policy = snapshot(request, merged);
        } catch (PolicyException e) {
            log.debug("Revalidated headers for {} are malformed, keeping previous lifetime: {}",
                    stored.getKey(), e.getMessage());
            policy = stored.getPolicy().toBuilder()
                    .responseTime(clock.instant())
                    .initialAgeSeconds(0)
                    .build();
        }

        return StoredEntry.builder()
                .key(stored.getKey())
                .response(merged)
                .policy(policy)
                .build();
    }

    /**
     * Why a response cannot be stored, or null if it can.
     */
    private String unstorableReason(RequestParts request, HttpResponseRecord response) {
        if (!request.isCacheableMethod()) {
            return "method " + request.getMethod() + " is not cacheable";
        }
        if (!UNDERSTOOD_STATUSES.contains(response.getStatus())) {
            return "status not understood";
        }

        CacheControlDirectives requestCaching =
                CacheControlDirectives.parse(request.getHeaders().getFirst(HttpHeaders.CACHE_CONTROL));
        CacheControlDirectives responseCaching = CacheControlDirectives.parse(response.header(HttpHeaders.CACHE_CONTROL));

        if (requestCaching.has("no-store") || responseCaching.has("no-store")) {
            return "no-store";
        }
        if (shared && responseCaching.has("private")) {
            return "private response in a shared cache";
        }

        long sharedMaxAge = responseCaching.seconds("s-maxage");
        long maxAge = responseCaching.seconds("max-age");

        // Responses to authorized requests need explicit permission in a shared cache
        if (shared && request.getHeaders().containsKey(HttpHeaders.AUTHORIZATION)
                && !responseCaching.has("public")
                && !responseCaching.has("must-revalidate")
                && sharedMaxAge < 0) {
            return "authorized request";
        }
        if ("*".equals(trim(response.header(HttpHeaders.VARY)))) {
            return "Vary: *";
        }

        boolean hasSignal = response.header(HttpHeaders.EXPIRES) != null
                || maxAge >= 0
                || (shared && sharedMaxAge >= 0)
                || responseCaching.has("public")
                || CACHEABLE_BY_DEFAULT.contains(response.getStatus());
        return hasSignal ? null : "no freshness information";
    }

    private static long ageHeader(HttpResponseRecord response) {
        String value = response.header(HttpHeaders.AGE);
        if (value == null) {
            return 0;
        }
        try {
            return CacheControlDirectives.deltaSeconds(value, HttpHeaders.AGE);
        } catch (PolicyException e) {
            return 0;
        }
    }

    private static Instant httpDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean containsToken(String header, String token) {
        if (header == null) {
            return false;
        }
        for (String part : header.split(",")) {
            if (part.trim().equalsIgnoreCase(token)) {
                return true;
            }
        }
        return false;
    }

    private static String weak(String etag) {
        String trimmed = etag.trim();
        return trimmed.startsWith("W/") ? trimmed.substring(2) : trimmed;
    }

    private static String trim(String value) {
        return value != null ? value.trim() : null;
    }
}
