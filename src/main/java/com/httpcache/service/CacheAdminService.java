package com.httpcache.service;

import com.httpcache.model.RangeField;
import com.httpcache.model.StoredEntry;
import com.httpcache.model.dto.CacheEntrySummary;
import com.httpcache.model.dto.CacheStatistics;
import com.httpcache.repository.CacheManager;
import com.httpcache.repository.IndexedCacheManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Admin service for cache inspection and management.
 *
 * Queries by URL, range, staleness and body text need the indexed backend;
 * on other backends they return empty.
 */
@Slf4j
@Service
public class CacheAdminService {

    private final HttpCacheFilter httpCacheFilter;
    private final Clock clock;

    public CacheAdminService(HttpCacheFilter httpCacheFilter, Clock clock) {
        this.httpCacheFilter = httpCacheFilter;
        this.clock = clock;
    }

    public CacheStatistics getStatistics() {
        return httpCacheFilter.getStatistics();
    }

    public boolean supportsQueries() {
        return httpCacheFilter.getCacheManager() instanceof IndexedCacheManager;
    }

    /**
     * All entries, or those stored for {@code url} when given.
     */
    public Optional<List<CacheEntrySummary>> getEntries(String url) {
        return query(store -> url == null || url.isBlank()
                ? store.entries()
                : store.lookupByTag(url));
    }

    public Optional<List<CacheEntrySummary>> getEntriesInRange(RangeField field, long low, long high) {
        return query(store -> store.range(field, low, high));
    }

    public Optional<List<CacheEntrySummary>> getStaleEntries() {
        return query(IndexedCacheManager::staleView);
    }

    public Optional<List<CacheEntrySummary>> searchEntries(String text) {
        return query(store -> store.search(text));
    }

    public Mono<Void> deleteEntry(String key) {
        return httpCacheFilter.evict(key)
                .doOnSuccess(ignored -> log.info("Deleted cache entry: key={}", key));
    }

    public void clearCache() {
        CacheManager manager = httpCacheFilter.getCacheManager();
        manager.clear();
        log.info("Cleared {} cache", manager.getName());
    }

    private Optional<List<CacheEntrySummary>> query(Function<IndexedCacheManager, List<StoredEntry>> query) {
        if (!(httpCacheFilter.getCacheManager() instanceof IndexedCacheManager store)) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return Optional.of(query.apply(store).stream()
                .map(entry -> CacheEntrySummary.of(entry, now))
                .collect(Collectors.toList()));
    }
}
