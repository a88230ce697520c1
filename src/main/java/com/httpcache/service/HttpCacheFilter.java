package com.httpcache.service;

import com.httpcache.model.CacheHeaders;
import com.httpcache.model.CacheMode;
import com.httpcache.model.Freshness;
import com.httpcache.model.FreshnessPolicy;
import com.httpcache.model.HttpCacheOptions;
import com.httpcache.model.HttpResponseRecord;
import com.httpcache.model.RequestParts;
import com.httpcache.model.StoredEntry;
import com.httpcache.model.dto.CacheStatistics;
import com.httpcache.repository.CacheManager;
import com.httpcache.service.key.CacheKeyDeriver;
import com.httpcache.service.policy.FreshnessPolicyEngine;
import com.httpcache.service.policy.PolicyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WebClient filter that answers requests from a {@link CacheManager} when the
 * cache-control rules allow it, and keeps the storage up to date otherwise.
 *
 * Flow per request:
 * 1. Resolve the mode (mode function, override header, configured mode)
 * 2. NO_STORE: forward untouched
 * 3. Look up the derived key; storage failures count as a miss
 * 4. Miss: forward, store if storable (ONLY_IF_CACHED answers 504 instead)
 * 5. Hit: serve, revalidate or refetch depending on mode and freshness
 *
 * Storage failures never fail the request; only transport errors reach the caller.
 * Bodies are buffered without a codec limit; one larger than
 * {@link HttpCacheOptions#getMaxBodySize()} is delivered but never stored.
 */
@Slf4j
public class HttpCacheFilter implements ExchangeFilterFunction {

    private static final Duration DEFAULT_STORAGE_TIMEOUT = Duration.ofSeconds(5);

    private static final byte[] EMPTY_BODY = new byte[0];

    private final CacheManager manager;
    private final CacheMode mode;
    private final HttpCacheOptions options;
    private final CacheKeyDeriver keyDeriver;
    private final FreshnessPolicyEngine policyEngine;
    private final CacheModeParser modeParser;
    private final Duration storageTimeout;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong revalidations = new AtomicLong();
    private final AtomicLong stores = new AtomicLong();
    private final AtomicLong storageErrors = new AtomicLong();

    public HttpCacheFilter(CacheManager manager, CacheMode mode, HttpCacheOptions options) {
        this(manager, mode, options,
                new FreshnessPolicyEngine(Clock.systemUTC(), options.isShared()),
                new CacheModeParser(),
                DEFAULT_STORAGE_TIMEOUT);
    }

    /**
     * @param policyEngine   must use the same shared or private rules as {@code options}
     * @param modeParser     parser for the per-request mode header, or null to ignore the header
     * @param storageTimeout bound on each storage call; exceeding it counts as a storage failure
     */
    public HttpCacheFilter(CacheManager manager,
                           CacheMode mode,
                           HttpCacheOptions options,
                           FreshnessPolicyEngine policyEngine,
                           CacheModeParser modeParser,
                           Duration storageTimeout) {
        if (options.isShared() != policyEngine.isShared()) {
            throw new IllegalArgumentException("Options ask for a " + cacheKind(options.isShared())
                    + " cache but the policy engine applies " + cacheKind(policyEngine.isShared()) + " cache rules");
        }
        this.manager = manager;
        this.mode = mode;
        this.options = options;
        this.keyDeriver = new CacheKeyDeriver(options.getCacheKey());
        this.policyEngine = policyEngine;
        this.modeParser = modeParser;
        this.storageTimeout = storageTimeout;
        log.info("Initialized HTTP cache filter: backend={}, mode={}, shared={}",
                manager.getName(), mode, policyEngine.isShared());
    }

    @Override
    public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
        RequestParts parts = RequestParts.from(request);
        CacheMode requestMode = resolveMode(parts);
        ClientRequest outbound = stripControlHeaders(request);

        if (!requestMode.readsStorage()) {
            log.debug("Cache bypass ({}) for {} {}", requestMode, parts.getMethod(), parts.getUri());
            return next.exchange(outbound);
        }
        if (!parts.isCacheableMethod()) {
            return forwardAndInvalidate(outbound, parts, next);
        }
        if (hasConditions(parts.getHeaders())) {
            // The caller is validating its own copy; let the origin answer it
            log.debug("Caller-supplied conditional request, forwarding {}", parts.getUri());
            return next.exchange(outbound);
        }

        String key = keyDeriver.derive(parts);
        return lookup(key)
                .flatMap(cached -> cached
                        .map(entry -> onHit(entry, outbound, parts, key, requestMode, next))
                        .orElseGet(() -> onMiss(outbound, parts, key, requestMode, next)));
    }

    /**
     * Remove an entry by key.
     */
    public Mono<Void> evict(String key) {
        return Mono.fromRunnable(() -> manager.delete(key))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(storageTimeout)
                .then();
    }

    public CacheStatistics getStatistics() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long revalidationCount = revalidations.get();
        long total = hitCount + missCount + revalidationCount;

        long entries;
        try {
            entries = manager.size();
        } catch (RuntimeException e) {
            log.warn("Could not count cache entries", e);
            entries = -1;
        }

        return CacheStatistics.builder()
                .backend(manager.getName())
                .mode(mode.name())
                .entries(entries)
                .hits(hitCount)
                .misses(missCount)
                .revalidations(revalidationCount)
                .stores(stores.get())
                .storageErrors(storageErrors.get())
                .hitRate(total > 0 ? (double) (hitCount + revalidationCount) / total : 0.0)
                .build();
    }

    public CacheManager getCacheManager() {
        return manager;
    }

    public CacheKeyDeriver getKeyDeriver() {
        return keyDeriver;
    }

    public FreshnessPolicyEngine getPolicyEngine() {
        return policyEngine;
    }

    // ========== Decision protocol ==========

    private Mono<ClientResponse> onMiss(ClientRequest outbound, RequestParts parts, String key,
                                        CacheMode requestMode, ExchangeFunction next) {
        if (requestMode == CacheMode.ONLY_IF_CACHED) {
            log.debug("Cache MISS with only-if-cached: {}", key);
            misses.incrementAndGet();
            return Mono.just(gatewayTimeout());
        }
        log.debug("Cache MISS: {}", key);
        return fetchAndStore(outbound, parts, key, requestMode, false, next);
    }

    private Mono<ClientResponse> onHit(StoredEntry entry, ClientRequest outbound, RequestParts parts, String key,
                                       CacheMode requestMode, ExchangeFunction next) {
        if (requestMode == CacheMode.NO_CACHE) {
            log.debug("Cache HIT ignored (no-cache), forwarding: {}", key);
            return fetchAndStore(outbound, parts, key, requestMode, true, next);
        }
        if (requestMode.servesStale()) {
            log.debug("Cache HIT ({}): {}", requestMode, key);
            hits.incrementAndGet();
            return Mono.just(serve(entry));
        }

        Freshness freshness = policyEngine.evaluate(entry.getPolicy());
        if (freshness.isFresh()) {
            log.debug("Cache HIT (fresh): {}", key);
            hits.incrementAndGet();
            return Mono.just(serve(entry));
        }
        if (freshness.revalidatable()) {
            log.debug("Cache HIT (stale), revalidating: {}", key);
            return revalidate(entry, outbound, parts, key, next);
        }
        log.debug("Cache HIT (stale, no validator), refetching: {}", key);
        return fetchAndStore(outbound, parts, key, requestMode, true, next);
    }

    private Mono<ClientResponse> revalidate(StoredEntry entry, ClientRequest outbound, RequestParts parts,
                                            String key, ExchangeFunction next) {
        ClientRequest conditional = policyEngine.buildConditionalRequest(outbound, entry.getPolicy());
        return next.exchange(conditional)
                .flatMap(response -> {
                    if (exceedsBodyLimit(response, parts)) {
                        log.debug("Revalidation of {} returned an oversized body, dropping entry", key);
                        misses.incrementAndGet();
                        return remove(key).thenReturn(uncached(response, CacheHeaders.HIT));
                    }
                    return toRecord(response, parts)
                            .flatMap(record -> onRevalidated(entry, record, outbound, parts, key, next));
                });
    }

    private Mono<ClientResponse> onRevalidated(StoredEntry entry, HttpResponseRecord record, ClientRequest outbound,
                                               RequestParts parts, String key, ExchangeFunction next) {
        if (record.getStatus() != HttpStatus.NOT_MODIFIED.value()) {
            log.debug("Revalidation of {} returned {}, replacing entry", key, record.getStatus());
            misses.incrementAndGet();
            return storeAndRespond(record, parts, key, CacheMode.DEFAULT, true, true);
        }
        if (!policyEngine.validatorsMatch(entry, record)) {
            log.debug("304 for {} names another representation, refetching", key);
            return remove(key).then(Mono.defer(() ->
                    fetchAndStore(outbound, parts, key, CacheMode.DEFAULT, true, next)));
        }

        revalidations.incrementAndGet();
        StoredEntry merged = policyEngine.mergeRevalidation(entry, record, parts);
        Mono<Void> write = policyEngine.isStorable(parts, merged.getResponse())
                ? store(key, merged.getResponse(), merged.getPolicy())
                : remove(key);
        return write.thenReturn(serve(merged));
    }

    private Mono<ClientResponse> fetchAndStore(ClientRequest outbound, RequestParts parts, String key,
                                               CacheMode requestMode, boolean lookupHit, ExchangeFunction next) {
        return next.exchange(outbound)
                .flatMap(response -> {
                    misses.incrementAndGet();
                    if (exceedsBodyLimit(response, parts)) {
                        log.debug("Body of {} exceeds {} bytes, not storing", key, options.getMaxBodySize());
                        return Mono.just(uncached(response, lookupHit ? CacheHeaders.HIT : CacheHeaders.MISS));
                    }
                    return toRecord(response, parts)
                            .flatMap(record -> storeAndRespond(record, parts, key, requestMode, lookupHit, false));
                });
    }

    /**
     * @param replacing drop the existing entry when the new response cannot be stored
     */
    private Mono<ClientResponse> storeAndRespond(HttpResponseRecord record, RequestParts parts, String key,
                                                 CacheMode requestMode, boolean lookupHit, boolean replacing) {
        Optional<FreshnessPolicy> policy;
        if (record.bodyLength() > options.getMaxBodySize()) {
            log.debug("Body of {} exceeds {} bytes, not storing", key, options.getMaxBodySize());
            policy = Optional.empty();
        } else if (requestMode == CacheMode.IGNORE_RULES) {
            policy = snapshotIgnoringRules(parts, record);
        } else {
            policy = policyEngine.assessStorability(parts, record);
        }
        Mono<Void> write = policy
                .map(p -> store(key, record, p))
                .orElseGet(() -> replacing ? remove(key) : Mono.empty());
        return write.thenReturn(respond(record, CacheHeaders.MISS, lookupHit ? CacheHeaders.HIT : CacheHeaders.MISS));
    }

    private Optional<FreshnessPolicy> snapshotIgnoringRules(RequestParts parts, HttpResponseRecord record) {
        try {
            return Optional.of(policyEngine.snapshot(parts, record));
        } catch (PolicyException e) {
            log.debug("Cannot snapshot policy for {}: {}", parts.getUri(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Unsafe methods invalidate the stored GET response of the same URI once the origin accepts them.
     */
    private Mono<ClientResponse> forwardAndInvalidate(ClientRequest outbound, RequestParts parts,
                                                      ExchangeFunction next) {
        return next.exchange(outbound)
                .flatMap(response -> {
                    HttpStatusCode status = response.statusCode();
                    if (status.is2xxSuccessful() || status.is3xxRedirection()) {
                        String key = keyDeriver.derive(parts.withMethod(HttpMethod.GET));
                        log.debug("{} {} succeeded, invalidating {}", parts.getMethod(), parts.getUri(), key);
                        return remove(key).thenReturn(response);
                    }
                    return Mono.just(response);
                });
    }

    private CacheMode resolveMode(RequestParts parts) {
        if (options.getCacheModeFn() != null) {
            CacheMode resolved = options.getCacheModeFn().apply(parts);
            if (resolved != null) {
                return resolved;
            }
        }
        if (modeParser != null) {
            Optional<CacheMode> requested = modeParser.parse(parts.getHeaders());
            if (requested.isPresent()) {
                return requested.get();
            }
        }
        return mode;
    }

    // ========== Storage (failures degrade to "not cached") ==========

    private Mono<Optional<StoredEntry>> lookup(String key) {
        return Mono.fromCallable(() -> manager.get(key))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(storageTimeout)
                .onErrorResume(e -> {
                    storageFailure("get", key, e);
                    return Mono.just(Optional.empty());
                });
    }

    private Mono<Void> store(String key, HttpResponseRecord record, FreshnessPolicy policy) {
        return Mono.fromRunnable(() -> manager.put(key, record, policy))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(storageTimeout)
                .doOnSuccess(ignored -> stores.incrementAndGet())
                .onErrorResume(e -> {
                    storageFailure("put", key, e);
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> remove(String key) {
        return evict(key)
                .onErrorResume(e -> {
                    storageFailure("delete", key, e);
                    return Mono.empty();
                });
    }

    private static String cacheKind(boolean shared) {
        return shared ? "shared" : "private";
    }

    private void storageFailure(String operation, String key, Throwable e) {
        storageErrors.incrementAndGet();
        log.warn("Cache {} failed for key={}, continuing without cache: {}", operation, key, e.toString());
    }

    // ========== Response conversion ==========

    private Mono<HttpResponseRecord> toRecord(ClientResponse response, RequestParts parts) {
        HttpHeaders headers = response.headers().asHttpHeaders();
        int status = response.statusCode().value();
        return DataBufferUtils.join(response.body(BodyExtractors.toDataBuffers()))
                .map(HttpCacheFilter::drain)
                .defaultIfEmpty(EMPTY_BODY)
                .map(body -> HttpResponseRecord.builder()
                        .status(status)
                        .headers(HttpResponseRecord.flatten(headers))
                        .body(body)
                        .url(parts.getUri())
                        .httpVersion(parts.getVersion())
                        .build());
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    /**
     * A declared Content-Length over the limit is known before reading the body,
     * so such a response streams through without being buffered.
     */
    private boolean exceedsBodyLimit(ClientResponse response, RequestParts parts) {
        return parts.getMethod() != HttpMethod.HEAD
                && response.headers().contentLength().orElse(-1L) > options.getMaxBodySize();
    }

    private static ClientResponse uncached(ClientResponse response, String lookupStatus) {
        return response.mutate()
                .headers(headers -> {
                    headers.set(CacheHeaders.CACHE, CacheHeaders.MISS);
                    headers.set(CacheHeaders.CACHE_LOOKUP, lookupStatus);
                })
                .build();
    }

    private ClientResponse serve(StoredEntry entry) {
        long age = Math.max(0, entry.getPolicy().ageAt(policyEngine.now()));
        return respond(entry.getResponse(), CacheHeaders.HIT, CacheHeaders.HIT, age);
    }

    private static ClientResponse respond(HttpResponseRecord record, String cacheStatus, String lookupStatus) {
        return respond(record, cacheStatus, lookupStatus, -1);
    }

    /**
     * @param age value for the Age header, or -1 to leave the record's own
     */
    private static ClientResponse respond(HttpResponseRecord record, String cacheStatus, String lookupStatus,
                                          long age) {
        Flux<DataBuffer> content = record.bodyLength() == 0
                ? Flux.empty()
                : Flux.defer(() -> Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(record.getBody())));
        return ClientResponse.create(HttpStatusCode.valueOf(record.getStatus()))
                .headers(headers -> {
                    headers.addAll(record.toHttpHeaders());
                    headers.set(CacheHeaders.CACHE, cacheStatus);
                    headers.set(CacheHeaders.CACHE_LOOKUP, lookupStatus);
                    if (age >= 0) {
                        headers.set(HttpHeaders.AGE, Long.toString(age));
                    }
                })
                .body(content)
                .build();
    }

    private static ClientResponse gatewayTimeout() {
        return ClientResponse.create(HttpStatus.GATEWAY_TIMEOUT)
                .header(CacheHeaders.CACHE, CacheHeaders.MISS)
                .header(CacheHeaders.CACHE_LOOKUP, CacheHeaders.MISS)
                .build();
    }

    private static ClientRequest stripControlHeaders(ClientRequest request) {
        if (!request.headers().containsKey(CacheHeaders.CACHE_MODE)) {
            return request;
        }
        return ClientRequest.from(request)
                .headers(headers -> headers.remove(CacheHeaders.CACHE_MODE))
                .build();
    }

    private static boolean hasConditions(HttpHeaders headers) {
        return headers.containsKey(HttpHeaders.IF_NONE_MATCH) || headers.containsKey(HttpHeaders.IF_MODIFIED_SINCE);
    }
}
